package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.support.BrowserDownloader;
import fun.fengwk.mph.core.service.acquire.support.PdfHttpFetcher;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lookup of {@code {mirror}/{key}} across the configured mirrors in order.
 *
 * @author fengwk
 */
@Slf4j
public abstract class AbstractMirrorLookupSource extends AbstractAcquisitionSource {

    private static final Pattern LOCATION_HREF_PATTERN = Pattern.compile("location\\.href='([^']+)'");
    private static final Pattern PDF_URL_PATTERN = Pattern.compile("(https?://[^\"'<>\\s]+\\.pdf[^\"'<>\\s]*)");

    protected AbstractMirrorLookupSource(
        AcquireProperties acquireProperties,
        PdfHttpFetcher pdfHttpFetcher,
        BrowserDownloader browserDownloader
    ) {
        super(acquireProperties, pdfHttpFetcher, browserDownloader);
    }

    /**
     * Path segment appended to the mirror url.
     */
    protected abstract String lookupKey(AcquisitionRequest request);

    @Override
    public SourceOutcome attempt(AcquisitionContext context) {
        String key = lookupKey(context.getRequest());
        List<String> reasons = new ArrayList<>();
        AcquisitionFailure lastFailure = AcquisitionFailure.NOT_FOUND;
        for (String mirror : acquireProperties.getLookupMirrors()) {
            SourceOutcome outcome = tryMirror(context, StringUtils.removeEnd(mirror, "/"), key);
            if (outcome.success()) {
                return outcome;
            }
            lastFailure = outcome.failure();
            reasons.add(mirror + ": " + outcome.message());
        }
        return SourceOutcome.miss(lastFailure, "all mirrors failed [" + String.join("; ", reasons) + "]");
    }

    private SourceOutcome tryMirror(AcquisitionContext context, String mirror, String key) {
        String url = mirror + "/" + key;
        if (!open(context, url)) {
            return SourceOutcome.miss(AcquisitionFailure.TRANSIENT_NETWORK, "navigate failed");
        }

        String html = context.getSession().content();
        String lowerHtml = html.toLowerCase(Locale.ROOT);
        for (String marker : acquireProperties.getLookupNotFoundMarkers()) {
            if (lowerHtml.contains(marker.toLowerCase(Locale.ROOT))) {
                return SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "article not found");
            }
        }

        String pdfUrl = locatePdfUrl(html, url);
        if (pdfUrl == null) {
            return SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "pdf link not found");
        }
        log.debug("mirror pdf located, mirror={}, pdfUrl={}", mirror, pdfUrl);
        return fetchThenDownload(context, pdfUrl, url);
    }

    /**
     * Locate the PDF via the embedded viewer, the download button or a bare PDF url in the markup.
     */
    static String locatePdfUrl(String html, String pageUrl) {
        Document document = Jsoup.parse(html, pageUrl);
        for (String selector : List.of("embed#pdf", "iframe#pdf")) {
            Element element = document.selectFirst(selector);
            if (element != null && StringUtils.isNotBlank(element.attr("src"))) {
                return stripFragment(resolveUrl(pageUrl, element.attr("src")));
            }
        }

        Element button = document.selectFirst("a[onclick*='.pdf']");
        if (button != null) {
            Matcher matcher = LOCATION_HREF_PATTERN.matcher(button.attr("onclick"));
            if (matcher.find()) {
                return stripFragment(resolveUrl(pageUrl, matcher.group(1)));
            }
        }

        Matcher matcher = PDF_URL_PATTERN.matcher(html);
        if (matcher.find()) {
            return stripFragment(matcher.group(1));
        }
        return null;
    }

}
