package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionSourceType;
import fun.fengwk.mph.core.service.acquire.support.BrowserDownloader;
import fun.fengwk.mph.core.service.acquire.support.PdfHttpFetcher;
import fun.fengwk.mph.core.service.browser.session.FetchSession;
import fun.fengwk.mph.core.service.crawl.CrawlProperties;
import fun.fengwk.mph.core.service.crawl.LinkNormalizer;
import fun.fengwk.mph.core.service.guard.AntiBlockDetector;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Download through the detail page of the originating site, using the browser's cookies.
 *
 * <p>Subject to the session's sticky block state.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DirectSourceAcquisition extends AbstractAcquisitionSource {

    private static final Pattern DOWNLOAD_HREF_PATTERN =
        Pattern.compile("href=[\"']([^\"']*(?:dflag=pdfdown|nhdown)[^\"']*)[\"']");

    private final CrawlProperties crawlProperties;
    private final AntiBlockDetector antiBlockDetector;

    public DirectSourceAcquisition(
        AcquireProperties acquireProperties,
        PdfHttpFetcher pdfHttpFetcher,
        BrowserDownloader browserDownloader,
        CrawlProperties crawlProperties,
        AntiBlockDetector antiBlockDetector
    ) {
        super(acquireProperties, pdfHttpFetcher, browserDownloader);
        this.crawlProperties = crawlProperties;
        this.antiBlockDetector = antiBlockDetector;
    }

    @Override
    public AcquisitionSourceType type() {
        return AcquisitionSourceType.DIRECT_SOURCE;
    }

    @Override
    public boolean isApplicable(AcquisitionRequest request) {
        return StringUtils.isNotBlank(request.getLink())
            && request.getLink().toLowerCase(Locale.ROOT).contains(crawlProperties.getOriginDomain().toLowerCase(Locale.ROOT));
    }

    @Override
    public SourceOutcome attempt(AcquisitionContext context) {
        FetchSession session = context.getSession();
        if (session.blockState().isBlocked()) {
            return SourceOutcome.miss(AcquisitionFailure.BLOCKED, "session blocked");
        }

        String detailUrl = LinkNormalizer.normalize(context.getRequest().getLink(), crawlProperties.getHost());
        if (!open(context, detailUrl)) {
            return SourceOutcome.miss(AcquisitionFailure.TRANSIENT_NETWORK, "navigate detail page failed");
        }
        if (antiBlockDetector.check(session)) {
            return SourceOutcome.miss(AcquisitionFailure.BLOCKED, "blocked on detail page");
        }

        String downloadUrl = locateDownloadUrl(session.content(), detailUrl);
        if (downloadUrl == null) {
            return SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "download link not found");
        }

        log.debug("direct download located, detailUrl={}, downloadUrl={}", detailUrl, downloadUrl);
        PdfHttpFetcher.HttpTransfer transfer = pdfHttpFetcher.fetch(
            downloadUrl, requestHeaders(session, detailUrl), session.cookies(), context.getTarget());
        if (transfer.success()) {
            return SourceOutcome.success(context.getTarget(), "http fetch: " + downloadUrl);
        }
        return SourceOutcome.miss(transfer.failure(), transfer.message());
    }

    /**
     * PDF button first, then the CAJ link rewritten to its PDF variant, then a raw markup scan.
     */
    static String locateDownloadUrl(String html, String pageUrl) {
        Document document = Jsoup.parse(html, pageUrl);
        Element pdfButton = document.selectFirst("a.btn-dlpdf");
        if (pdfButton != null && StringUtils.isNotBlank(pdfButton.attr("href"))) {
            return resolveUrl(pageUrl, pdfButton.attr("href"));
        }

        Element cajButton = document.selectFirst("a.btn-dlcaj, a[href*='nhdown']");
        if (cajButton != null && StringUtils.isNotBlank(cajButton.attr("href"))) {
            return resolveUrl(pageUrl, cajButton.attr("href").replace("nhdown", "pdfdown"));
        }

        Matcher matcher = DOWNLOAD_HREF_PATTERN.matcher(html);
        if (matcher.find()) {
            String href = Parser.unescapeEntities(matcher.group(1), true).replace("nhdown", "pdfdown");
            return resolveUrl(pageUrl, href);
        }
        return null;
    }

}
