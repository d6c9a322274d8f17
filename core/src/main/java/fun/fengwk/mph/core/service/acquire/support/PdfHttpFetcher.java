package fun.fengwk.mph.core.service.acquire.support;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Streams candidate documents over HTTP into a sibling {@code .part} file and moves plausible PDFs onto the target.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class PdfHttpFetcher {

    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String PART_SUFFIX = ".part";

    private final AcquireProperties acquireProperties;
    private final HttpClient httpClient;
    private final ExecutorService bodyReader;

    @Autowired
    public PdfHttpFetcher(AcquireProperties acquireProperties) {
        this(acquireProperties, HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(acquireProperties.getHttpConnectTimeoutMs()))
            .build());
    }

    PdfHttpFetcher(AcquireProperties acquireProperties, HttpClient httpClient) {
        this.acquireProperties = acquireProperties;
        this.httpClient = httpClient;
        AtomicInteger threadIdGen = new AtomicInteger();
        this.bodyReader = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "pdf-body-reader-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        bodyReader.shutdownNow();
    }

    /**
     * Fetch the url into the target file.
     *
     * @param headers extra request headers, e.g. Referer or User-Agent
     * @param cookies cookies sent with the request
     */
    public HttpTransfer fetch(String url, Map<String, String> headers, Map<String, String> cookies, Path target) {
        HttpRequest request;
        try {
            request = buildGetRequest(url, headers, cookies);
        } catch (IllegalArgumentException ex) {
            log.debug("build pdf request failed, url={}, error={}", url, ex.getMessage());
            return HttpTransfer.failure(0, AcquisitionFailure.NOT_FOUND, "invalid url: " + url);
        }

        Path part = target.resolveSibling(target.getFileName() + PART_SUFFIX);
        long timeoutMs = acquireProperties.getHttpRequestTimeoutMs();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            int statusCode = response.statusCode();
            if (statusCode != 200) {
                response.body().close();
                log.debug("pdf fetch rejected, url={}, statusCode={}", url, statusCode);
                return HttpTransfer.failure(statusCode, AcquisitionFailure.NOT_FOUND, "http status " + statusCode);
            }
            Files.createDirectories(target.toAbsolutePath().getParent());
            if (!copyBody(response.body(), part, deadline)) {
                log.warn("pdf fetch timeout while reading body, url={}, timeoutMs={}, received={}",
                    url, timeoutMs, PdfPayloads.sizeOf(part));
                return HttpTransfer.failure(statusCode, AcquisitionFailure.TIMEOUT,
                    "timeout: body not received within " + timeoutMs + "ms");
            }

            String mime = PdfPayloads.resolveMime(toFirstValueHeaders(response.headers().map()));
            if (!PdfPayloads.isPlausiblePdf(part, mime, acquireProperties.getMinPdfBytes())) {
                log.debug("pdf fetch not plausible, url={}, mime={}, size={}", url, mime, PdfPayloads.sizeOf(part));
                return HttpTransfer.failure(statusCode, AcquisitionFailure.VALIDATION,
                    "not a pdf, mime=" + mime + ", size=" + PdfPayloads.sizeOf(part));
            }

            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("pdf fetched, url={}, target={}, size={}", url, target, PdfPayloads.sizeOf(target));
            return HttpTransfer.success(statusCode);
        } catch (HttpTimeoutException ex) {
            log.warn("pdf fetch timeout, url={}, error={}", url, ex.getMessage());
            return HttpTransfer.failure(0, AcquisitionFailure.TIMEOUT, "timeout: " + ex.getMessage());
        } catch (IOException ex) {
            log.warn("pdf fetch failed, url={}, error={}", url, ex.getMessage());
            return HttpTransfer.failure(0, AcquisitionFailure.TRANSIENT_NETWORK, "network error: " + ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("pdf fetch interrupted, url={}", url);
            return HttpTransfer.failure(0, AcquisitionFailure.TRANSIENT_NETWORK, "interrupted");
        } finally {
            deleteQuietly(part);
        }
    }

    /**
     * Copy the body into the part file, giving up at the deadline.
     *
     * <p>The read runs on a reader thread because a blocked read cannot observe a deadline by itself.
     *
     * @return false when the deadline passed before the body was fully received
     */
    private boolean copyBody(InputStream body, Path part, long deadline) throws IOException, InterruptedException {
        Future<Long> copy = bodyReader.submit(() -> {
            try (InputStream input = body) {
                return Files.copy(input, part, StandardCopyOption.REPLACE_EXISTING);
            }
        });
        try {
            copy.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException ex) {
            // Interrupting the reader releases its blocked read and closes the body.
            copy.cancel(true);
            return false;
        } catch (InterruptedException ex) {
            copy.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("read body failed", cause);
        }
    }

    private HttpRequest buildGetRequest(String url, Map<String, String> headers, Map<String, String> cookies) {
        if (StringUtils.isBlank(url)) {
            throw new IllegalArgumentException("url is blank");
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url.trim()))
            .GET()
            .header("Accept", "application/pdf,*/*")
            .timeout(Duration.ofMillis(acquireProperties.getHttpRequestTimeoutMs()));
        boolean hasUserAgent = false;
        if (headers != null) {
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                if (StringUtils.isBlank(entry.getKey()) || StringUtils.isBlank(entry.getValue())) {
                    continue;
                }
                builder.header(entry.getKey(), entry.getValue());
                hasUserAgent |= "user-agent".equalsIgnoreCase(entry.getKey());
            }
        }
        if (!hasUserAgent) {
            builder.header("User-Agent", DEFAULT_USER_AGENT);
        }
        if (cookies != null && !cookies.isEmpty()) {
            builder.header("Cookie", cookies.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("; ")));
        }
        return builder.build();
    }

    private static Map<String, String> toFirstValueHeaders(Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }

        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            List<String> values = entry.getValue();
            if (values == null || values.isEmpty() || StringUtils.isBlank(entry.getKey())) {
                continue;
            }
            normalized.put(entry.getKey().toLowerCase(Locale.ROOT), values.get(0));
        }
        return normalized;
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("failed to delete partial file, path={}, error={}", path, ex.getMessage());
        }
    }

    /**
     * Result of one HTTP transfer.
     */
    public record HttpTransfer(boolean success, int statusCode, AcquisitionFailure failure, String message) {

        static HttpTransfer success(int statusCode) {
            return new HttpTransfer(true, statusCode, null, "ok");
        }

        static HttpTransfer failure(int statusCode, AcquisitionFailure failure, String message) {
            return new HttpTransfer(false, statusCode, failure, message);
        }

    }

}
