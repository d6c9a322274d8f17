package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionSourceType;
import fun.fengwk.mph.core.service.acquire.support.BrowserDownloader;
import fun.fengwk.mph.core.service.acquire.support.PdfHttpFetcher;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Search the aggregator by title, open the first match and follow its mirror links.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AggregatorAcquisition extends AbstractAcquisitionSource {

    public AggregatorAcquisition(
        AcquireProperties acquireProperties,
        PdfHttpFetcher pdfHttpFetcher,
        BrowserDownloader browserDownloader
    ) {
        super(acquireProperties, pdfHttpFetcher, browserDownloader);
    }

    @Override
    public AcquisitionSourceType type() {
        return AcquisitionSourceType.AGGREGATOR;
    }

    @Override
    public boolean isApplicable(AcquisitionRequest request) {
        return StringUtils.isNotBlank(request.getTitle());
    }

    @Override
    public SourceOutcome attempt(AcquisitionContext context) {
        String baseUrl = StringUtils.removeEnd(acquireProperties.getAggregatorUrl(), "/");
        String searchUrl = baseUrl + "/search?q=" + encodeQuery(context.getRequest().getTitle());
        if (!open(context, searchUrl)) {
            return SourceOutcome.miss(AcquisitionFailure.TRANSIENT_NETWORK, "navigate search page failed");
        }

        Element match = Jsoup.parse(context.getSession().content(), searchUrl).selectFirst("a[href*='/md5/']");
        String detailUrl = match == null ? null : resolveUrl(searchUrl, match.attr("href"));
        if (detailUrl == null) {
            return SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "no search match");
        }
        if (!open(context, detailUrl)) {
            return SourceOutcome.miss(AcquisitionFailure.TRANSIENT_NETWORK, "navigate detail page failed");
        }

        List<String> mirrorLinks = collectMirrorLinks(context.getSession().content(), detailUrl);
        if (mirrorLinks.isEmpty()) {
            return SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "no mirror link");
        }

        SourceOutcome last = SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "no mirror link");
        for (String mirrorLink : mirrorLinks) {
            if (!open(context, mirrorLink)) {
                last = SourceOutcome.miss(AcquisitionFailure.TRANSIENT_NETWORK, "navigate mirror failed: " + mirrorLink);
                continue;
            }
            Element pdfAnchor = Jsoup.parse(context.getSession().content(), mirrorLink).selectFirst("a[href$='.pdf']");
            String pdfUrl = pdfAnchor == null ? null : resolveUrl(mirrorLink, pdfAnchor.attr("href"));
            last = browserDownloader.download(context.getSession(), pdfUrl == null ? mirrorLink : pdfUrl,
                context.getTarget());
            if (last.success()) {
                return last;
            }
            log.debug("aggregator mirror missed, link={}, reason={}", mirrorLink, last.message());
        }
        return last;
    }

    private List<String> collectMirrorLinks(String html, String pageUrl) {
        Document document = Jsoup.parse(html, pageUrl);
        Set<String> links = new LinkedHashSet<>();
        for (String selector : acquireProperties.getAggregatorDownloadSelectors()) {
            for (Element anchor : document.select(selector)) {
                String link = resolveUrl(pageUrl, anchor.attr("href"));
                if (link != null) {
                    links.add(link);
                }
            }
        }
        List<String> limited = new ArrayList<>(links);
        return limited.subList(0, Math.min(limited.size(), acquireProperties.getMaxCandidateLinks()));
    }

}
