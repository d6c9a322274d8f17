package fun.fengwk.mph.core.service.acquire.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.PdfFixtures;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * @author fengwk
 */
public class PdfHttpFetcherTest {

    @TempDir
    Path tempDir;

    private HttpServer server;
    private PdfHttpFetcher fetcher;
    private final AtomicReference<String> cookieHeader = new AtomicReference<>();
    private final AtomicReference<String> refererHeader = new AtomicReference<>();
    private final CountDownLatch releaseStalled = new CountDownLatch(1);

    @BeforeEach
    void setUp() throws IOException {
        fetcher = new PdfHttpFetcher(new AcquireProperties());
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/paper.pdf", exchange -> {
            cookieHeader.set(exchange.getRequestHeaders().getFirst("Cookie"));
            refererHeader.set(exchange.getRequestHeaders().getFirst("Referer"));
            write(exchange, 200, "application/pdf", PdfFixtures.pdfBytes());
        });
        server.createContext("/octet", exchange -> write(exchange, 200, "application/octet-stream", PdfFixtures.pdfBytes()));
        server.createContext("/landing", exchange -> write(exchange, 200, "text/html", PdfFixtures.htmlBytes()));
        server.createContext("/missing", exchange -> write(exchange, 404, "text/html", "not found".getBytes()));
        server.createContext("/stalled", exchange -> {
            exchange.getResponseHeaders().set("Content-Type", "application/pdf");
            exchange.sendResponseHeaders(200, 100000);
            OutputStream output = exchange.getResponseBody();
            output.write("%PDF-1.4\n".getBytes());
            output.flush();
            try {
                releaseStalled.await(15, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
    }

    @AfterEach
    void tearDown() {
        releaseStalled.countDown();
        fetcher.shutdown();
        server.stop(0);
    }

    @Test
    public void testFetchPdf() throws IOException {
        Path target = tempDir.resolve("paper.pdf");

        PdfHttpFetcher.HttpTransfer transfer = fetcher.fetch(baseUrl() + "/paper.pdf",
            Map.of("Referer", "https://kns.cnki.net/detail"), Map.of("SID", "abc"), target);

        assertThat(transfer.success()).isTrue();
        assertThat(transfer.statusCode()).isEqualTo(200);
        assertThat(Files.readAllBytes(target)).isEqualTo(PdfFixtures.pdfBytes());
        assertThat(tempDir.resolve("paper.pdf.part")).doesNotExist();
        assertThat(cookieHeader.get()).isEqualTo("SID=abc");
        assertThat(refererHeader.get()).isEqualTo("https://kns.cnki.net/detail");
    }

    @Test
    public void testSignedPayloadWithGenericMimeIsAccepted() {
        Path target = tempDir.resolve("octet.pdf");

        assertThat(fetcher.fetch(baseUrl() + "/octet", Map.of(), Map.of(), target).success()).isTrue();
        assertThat(target).exists();
    }

    @Test
    public void testFailedStatusLeavesNothingBehind() {
        Path target = tempDir.resolve("missing.pdf");

        PdfHttpFetcher.HttpTransfer transfer = fetcher.fetch(baseUrl() + "/missing", Map.of(), Map.of(), target);

        assertThat(transfer.success()).isFalse();
        assertThat(transfer.statusCode()).isEqualTo(404);
        assertThat(target).doesNotExist();
        assertThat(tempDir.resolve("missing.pdf.part")).doesNotExist();
    }

    @Test
    public void testHtmlPayloadIsRejected() {
        Path target = tempDir.resolve("landing.pdf");

        PdfHttpFetcher.HttpTransfer transfer = fetcher.fetch(baseUrl() + "/landing", Map.of(), Map.of(), target);

        assertThat(transfer.success()).isFalse();
        assertThat(transfer.failure()).isEqualTo(AcquisitionFailure.VALIDATION);
        assertThat(target).doesNotExist();
        assertThat(tempDir.resolve("landing.pdf.part")).doesNotExist();
    }

    @Test
    public void testStalledBodyTimesOut() {
        AcquireProperties properties = new AcquireProperties();
        properties.setHttpRequestTimeoutMs(1000);
        PdfHttpFetcher shortTimeoutFetcher = new PdfHttpFetcher(properties);
        Path target = tempDir.resolve("stalled.pdf");

        try {
            PdfHttpFetcher.HttpTransfer transfer = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> shortTimeoutFetcher.fetch(baseUrl() + "/stalled", Map.of(), Map.of(), target));

            assertThat(transfer.success()).isFalse();
            assertThat(transfer.failure()).isEqualTo(AcquisitionFailure.TIMEOUT);
            assertThat(target).doesNotExist();
            assertThat(tempDir.resolve("stalled.pdf.part")).doesNotExist();
        } finally {
            shortTimeoutFetcher.shutdown();
        }
    }

    @Test
    public void testUnreachableHost() {
        Path target = tempDir.resolve("down.pdf");
        int port = server.getAddress().getPort();
        server.stop(0);

        PdfHttpFetcher.HttpTransfer transfer = fetcher.fetch("http://127.0.0.1:" + port + "/paper.pdf",
            Map.of(), Map.of(), target);

        assertThat(transfer.success()).isFalse();
        assertThat(transfer.failure()).isEqualTo(AcquisitionFailure.TRANSIENT_NETWORK);
        assertThat(target).doesNotExist();
    }

    @Test
    public void testInvalidUrl() {
        PdfHttpFetcher.HttpTransfer transfer = fetcher.fetch(" ", Map.of(), Map.of(), tempDir.resolve("x.pdf"));

        assertThat(transfer.success()).isFalse();
        assertThat(transfer.failure()).isEqualTo(AcquisitionFailure.NOT_FOUND);
    }

    @Test
    public void testPayloadDetection() {
        assertThat(PdfPayloads.resolveMime(Map.of("Content-Type", "application/pdf; charset=binary")))
            .isEqualTo("application/pdf");
        assertThat(PdfPayloads.resolveMime(Map.of())).isEqualTo("application/octet-stream");
        assertThat(PdfPayloads.hasPdfSignature("%PDF-1.7".getBytes())).isTrue();
        assertThat(PdfPayloads.hasPdfSignature("%PD".getBytes())).isFalse();
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private static void write(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(body);
        }
    }

}
