package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionSourceType;
import fun.fengwk.mph.core.service.acquire.support.BrowserDownloader;
import fun.fengwk.mph.core.service.acquire.support.PdfHttpFetcher;
import fun.fengwk.mph.core.service.browser.session.FetchSession;
import fun.fengwk.mph.core.service.crawl.CrawlProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scholarly web search by title, trying the PDF links of the result page.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class WebSearchAcquisition extends AbstractAcquisitionSource {

    private final CrawlProperties crawlProperties;

    public WebSearchAcquisition(
        AcquireProperties acquireProperties,
        PdfHttpFetcher pdfHttpFetcher,
        BrowserDownloader browserDownloader,
        CrawlProperties crawlProperties
    ) {
        super(acquireProperties, pdfHttpFetcher, browserDownloader);
        this.crawlProperties = crawlProperties;
    }

    @Override
    public AcquisitionSourceType type() {
        return AcquisitionSourceType.WEB_SEARCH;
    }

    @Override
    public boolean isApplicable(AcquisitionRequest request) {
        return StringUtils.isNotBlank(request.getTitle());
    }

    @Override
    public SourceOutcome attempt(AcquisitionContext context) {
        FetchSession session = context.getSession();
        String baseUrl = StringUtils.removeEnd(acquireProperties.getWebSearchUrl(), "/");
        String searchUrl = baseUrl + "/scholar?q=" + encodeQuery(context.getRequest().getTitle());
        if (!open(context, searchUrl)) {
            return SourceOutcome.miss(AcquisitionFailure.TRANSIENT_NETWORK, "navigate search page failed");
        }

        String html = session.content();
        if (session.currentUrl().toLowerCase(Locale.ROOT).contains("sorry")
            || html.toLowerCase(Locale.ROOT).contains("captcha")) {
            log.warn("web search blocked, url={}", session.currentUrl());
            return SourceOutcome.miss(AcquisitionFailure.BLOCKED, "web search blocked");
        }

        List<String> pdfLinks = collectPdfLinks(html, searchUrl);
        if (pdfLinks.isEmpty()) {
            return SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "no pdf link in results");
        }

        SourceOutcome last = null;
        for (String pdfLink : pdfLinks) {
            last = fetchThenDownload(context, pdfLink, searchUrl);
            if (last.success()) {
                return last;
            }
            log.debug("web search link missed, link={}, reason={}", pdfLink, last.message());
        }
        return last;
    }

    private List<String> collectPdfLinks(String html, String pageUrl) {
        Document document = Jsoup.parse(html, pageUrl);
        String originDomain = crawlProperties.getOriginDomain().toLowerCase(Locale.ROOT);
        Set<String> links = new LinkedHashSet<>();
        for (String selector : acquireProperties.getWebSearchLinkSelectors()) {
            for (Element anchor : document.select(selector)) {
                String link = resolveUrl(pageUrl, anchor.attr("href"));
                if (link == null) {
                    continue;
                }
                String lowerLink = link.toLowerCase(Locale.ROOT);
                if (lowerLink.contains(".pdf") && !lowerLink.contains(originDomain)) {
                    links.add(link);
                }
            }
        }
        List<String> limited = new ArrayList<>(links);
        return limited.subList(0, Math.min(limited.size(), acquireProperties.getMaxCandidateLinks()));
    }

}
