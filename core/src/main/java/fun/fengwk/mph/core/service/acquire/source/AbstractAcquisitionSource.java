package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.support.BrowserDownloader;
import fun.fengwk.mph.core.service.acquire.support.PdfHttpFetcher;
import fun.fengwk.mph.core.service.browser.session.FetchSession;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared transfer and url helpers of the acquisition sources.
 *
 * @author fengwk
 */
@Slf4j
public abstract class AbstractAcquisitionSource implements AcquisitionSource {

    protected final AcquireProperties acquireProperties;
    protected final PdfHttpFetcher pdfHttpFetcher;
    protected final BrowserDownloader browserDownloader;

    protected AbstractAcquisitionSource(
        AcquireProperties acquireProperties,
        PdfHttpFetcher pdfHttpFetcher,
        BrowserDownloader browserDownloader
    ) {
        this.acquireProperties = acquireProperties;
        this.pdfHttpFetcher = pdfHttpFetcher;
        this.browserDownloader = browserDownloader;
    }

    /**
     * Navigate and pace, false when navigation failed.
     */
    protected boolean open(AcquisitionContext context, String url) {
        FetchSession session = context.getSession();
        if (!session.navigate(url)) {
            return false;
        }
        context.getPagePacer().pace(session);
        return true;
    }

    /**
     * HTTP fetch first, browser driven download when HTTP yields no plausible PDF.
     */
    protected SourceOutcome fetchThenDownload(AcquisitionContext context, String pdfUrl, String referer) {
        PdfHttpFetcher.HttpTransfer transfer = pdfHttpFetcher.fetch(
            pdfUrl, requestHeaders(context.getSession(), referer), Map.of(), context.getTarget());
        if (transfer.success()) {
            return SourceOutcome.success(context.getTarget(), "http fetch: " + pdfUrl);
        }
        log.debug("http fetch missed, fallback to browser download, url={}, reason={}", pdfUrl, transfer.message());
        return browserDownloader.download(context.getSession(), pdfUrl, context.getTarget());
    }

    protected Map<String, String> requestHeaders(FetchSession session, String referer) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (StringUtils.isNotBlank(referer)) {
            headers.put("Referer", referer);
        }
        if (StringUtils.isNotBlank(session.userAgent())) {
            headers.put("User-Agent", session.userAgent());
        }
        return headers;
    }

    /**
     * Resolve an href against the page url, null when it cannot be resolved.
     */
    static String resolveUrl(String baseUrl, String href) {
        if (StringUtils.isBlank(href)) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.startsWith("//")) {
            return "https:" + trimmed;
        }
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        try {
            return URI.create(baseUrl).resolve(trimmed).toString();
        } catch (IllegalArgumentException ex) {
            log.debug("resolve url failed, base={}, href={}, error={}", baseUrl, href, ex.getMessage());
            return null;
        }
    }

    static String stripFragment(String url) {
        if (url == null) {
            return null;
        }
        int fragmentIndex = url.indexOf('#');
        return fragmentIndex >= 0 ? url.substring(0, fragmentIndex) : url;
    }

    static String encodeQuery(String value) {
        return URLEncoder.encode(value.trim(), StandardCharsets.UTF_8).replace("+", "%20");
    }

}
