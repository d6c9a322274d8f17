package fun.fengwk.mph.core.service.acquire;

import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionResult;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionSourceType;
import fun.fengwk.mph.core.service.acquire.model.SourceAttempt;
import fun.fengwk.mph.core.service.acquire.source.AcquisitionContext;
import fun.fengwk.mph.core.service.acquire.source.AcquisitionSource;
import fun.fengwk.mph.core.service.acquire.source.SourceOutcome;
import fun.fengwk.mph.core.service.browser.session.FakeFetchSession;
import fun.fengwk.mph.core.service.browser.session.RequestPacer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class AcquisitionPipelineTest {

    private static final String LINK = "https://kns.cnki.net/kcms2/article/abstract?v=1";

    @TempDir
    Path downloadDir;

    private FakeFetchSession session;
    private AcquireProperties acquireProperties;
    private List<AcquisitionSourceType> invoked;

    @BeforeEach
    void setUp() {
        session = new FakeFetchSession();
        acquireProperties = new AcquireProperties();
        invoked = new ArrayList<>();
    }

    @Test
    public void testDoiOnlyRequestSkipsTitleSources() {
        AcquisitionPipeline pipeline = pipeline(allMissing());

        List<AcquisitionSourceType> plan = pipeline.planSources(request(null, "10.1038/nature12373", null), null);

        assertThat(plan).containsExactly(AcquisitionSourceType.DOI_LOOKUP);
    }

    @Test
    public void testDefaultOrder() {
        AcquisitionPipeline pipeline = pipeline(allMissing());

        List<AcquisitionSourceType> plan = pipeline.planSources(request("Graph networks", "10.1/x", LINK), null);

        assertThat(plan).containsExactly(
            AcquisitionSourceType.DIRECT_SOURCE,
            AcquisitionSourceType.DOI_LOOKUP,
            AcquisitionSourceType.TITLE_LOOKUP,
            AcquisitionSourceType.AGGREGATOR,
            AcquisitionSourceType.WEB_SEARCH);
    }

    @Test
    public void testExplicitOrderIsKeptAndDeduplicated() {
        AcquisitionPipeline pipeline = pipeline(allMissing());

        List<AcquisitionSourceType> plan = pipeline.planSources(request("Graph networks", "10.1/x", null),
            List.of(AcquisitionSourceType.WEB_SEARCH, AcquisitionSourceType.DIRECT_SOURCE,
                AcquisitionSourceType.DOI_LOOKUP, AcquisitionSourceType.WEB_SEARCH));

        assertThat(plan).containsExactly(AcquisitionSourceType.WEB_SEARCH, AcquisitionSourceType.DOI_LOOKUP);
    }

    @Test
    public void testFirstSuccessWinsAndDeliversPdf() throws Exception {
        List<AcquisitionSource> sources = List.of(
            source(AcquisitionSourceType.DOI_LOOKUP, r -> true,
                ctx -> SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "article not found")),
            source(AcquisitionSourceType.TITLE_LOOKUP, r -> true, this::deliverPdf),
            source(AcquisitionSourceType.WEB_SEARCH, r -> true, this::deliverPdf));

        AcquisitionResult result = pipeline(sources).acquire(request("Graph: networks?", "10.1/x", null), null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSourceUsed()).isEqualTo(AcquisitionSourceType.TITLE_LOOKUP);
        assertThat(invoked).containsExactly(AcquisitionSourceType.DOI_LOOKUP, AcquisitionSourceType.TITLE_LOOKUP);
        assertThat(result.getAttempts()).extracting(SourceAttempt::isSuccess).containsExactly(false, true);
        Path file = Path.of(result.getFilepath());
        assertThat(file.getFileName().toString()).isEqualTo("Graph_ networks_.pdf");
        assertThat(new String(Files.readAllBytes(file), StandardCharsets.US_ASCII)).startsWith("%PDF");
    }

    @Test
    public void testUnverifiedDeliveryIsRejected() {
        List<AcquisitionSource> sources = List.of(
            source(AcquisitionSourceType.DOI_LOOKUP, r -> true, ctx -> {
                PdfFixtures.write(ctx.getTarget(), PdfFixtures.htmlBytes());
                return SourceOutcome.success(ctx.getTarget(), "html posing as pdf");
            }));

        AcquisitionResult result = pipeline(sources).acquire(request(null, "10.1/x", null), null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAttempts()).singleElement()
            .extracting(SourceAttempt::getFailure).isEqualTo(AcquisitionFailure.VALIDATION);
        assertThat(downloadDir.resolve("10.1_x.pdf")).doesNotExist();
        assertThat(result.getMessage()).startsWith("all acquisition sources failed");
    }

    @Test
    public void testRejectedDeliveryKeepsExistingFile() throws Exception {
        Path existing = downloadDir.resolve("Graph.pdf");
        byte[] earlier = PdfFixtures.pdfBytes();
        PdfFixtures.write(existing, earlier);
        List<AcquisitionSource> sources = List.of(
            source(AcquisitionSourceType.TITLE_LOOKUP, r -> true, ctx -> {
                PdfFixtures.write(ctx.getTarget(), PdfFixtures.htmlBytes());
                return SourceOutcome.success(ctx.getTarget(), "html posing as pdf");
            }));

        AcquisitionResult result = pipeline(sources).acquire(request("Graph", null, null), null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(Files.readAllBytes(existing)).isEqualTo(earlier);
        try (Stream<Path> files = Files.list(downloadDir)) {
            assertThat(files).containsExactly(existing);
        }
    }

    @Test
    public void testDeliveryNeverReplacesExistingFile() throws Exception {
        Path existing = downloadDir.resolve("Graph.pdf");
        PdfFixtures.write(existing, PdfFixtures.htmlBytes());
        List<AcquisitionSource> sources = List.of(source(AcquisitionSourceType.TITLE_LOOKUP, r -> true, this::deliverPdf));

        AcquisitionResult result = pipeline(sources).acquire(request("Graph", null, null), null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(Path.of(result.getFilepath()).getFileName().toString()).isEqualTo("Graph_1.pdf");
        assertThat(Files.readAllBytes(existing)).isEqualTo(PdfFixtures.htmlBytes());
        try (Stream<Path> files = Files.list(downloadDir)) {
            assertThat(files).containsExactlyInAnyOrder(existing, downloadDir.resolve("Graph_1.pdf"));
        }
    }

    @Test
    public void testPlanIsStable() {
        AcquisitionPipeline pipeline = pipeline(allMissing());
        AcquisitionRequest request = request("Graph networks", "10.1/x", LINK);

        assertThat(pipeline.planSources(request, null)).isEqualTo(pipeline.planSources(request, null));
    }

    @Test
    public void testSourceExceptionMovesOn() {
        List<AcquisitionSource> sources = List.of(
            source(AcquisitionSourceType.DOI_LOOKUP, r -> true, ctx -> {
                throw new IllegalStateException("boom");
            }),
            source(AcquisitionSourceType.TITLE_LOOKUP, r -> true, this::deliverPdf));

        AcquisitionResult result = pipeline(sources).acquire(request("Title", "10.1/x", null), null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts().get(0).getFailure()).isEqualTo(AcquisitionFailure.TRANSIENT_NETWORK);
    }

    @Test
    public void testMissingIdentifiersAreRejected() {
        AcquisitionResult result = pipeline(allMissing()).acquire(request(" ", null, LINK), null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAttempts()).isEmpty();
        assertThat(invoked).isEmpty();
    }

    @Test
    public void testNoApplicableSource() {
        AcquisitionResult result = pipeline(allMissing())
            .acquire(request(null, "10.1/x", null), List.of(AcquisitionSourceType.WEB_SEARCH));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("no applicable acquisition source");
    }

    @Test
    public void testBatchStopsOnFailure() {
        List<AcquisitionSource> sources = List.of(
            source(AcquisitionSourceType.TITLE_LOOKUP, r -> true,
                ctx -> ctx.getRequest().getTitle().startsWith("bad")
                    ? SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "article not found")
                    : deliverPdf(ctx)));
        List<AcquisitionRequest> requests = List.of(
            request("good one", null, null), request("bad two", null, null), request("good three", null, null));

        List<AcquisitionResult> stopped = pipeline(sources).acquireBatch(requests, null, true);
        List<AcquisitionResult> all = pipeline(sources).acquireBatch(requests, null, false);

        assertThat(stopped).extracting(AcquisitionResult::isSuccess).containsExactly(true, false);
        assertThat(all).extracting(AcquisitionResult::isSuccess).containsExactly(true, false, true);
    }

    @Test
    public void testBatchPacesBetweenItems() {
        List<AcquisitionSource> sources = List.of(source(AcquisitionSourceType.TITLE_LOOKUP, r -> true, this::deliverPdf));
        AcquisitionPipeline pipeline = new AcquisitionPipeline(session, sources, acquireProperties, downloadDir,
            RequestPacer.NONE, new RequestPacer(3000, 0), fixedClock());

        pipeline.acquireBatch(List.of(request("a", null, null), request("b", null, null)), null, false);

        assertThat(session.getPauses()).containsExactly(3000L);
    }

    private SourceOutcome deliverPdf(AcquisitionContext context) {
        PdfFixtures.write(context.getTarget(), PdfFixtures.pdfBytes());
        return SourceOutcome.success(context.getTarget(), "delivered");
    }

    private AcquisitionPipeline pipeline(List<AcquisitionSource> sources) {
        return new AcquisitionPipeline(session, sources, acquireProperties, downloadDir,
            RequestPacer.NONE, RequestPacer.NONE, fixedClock());
    }

    private Clock fixedClock() {
        return Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneId.of("UTC"));
    }

    private List<AcquisitionSource> allMissing() {
        Function<AcquisitionContext, SourceOutcome> miss = ctx -> SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "miss");
        return List.of(
            source(AcquisitionSourceType.WEB_SEARCH, r -> r.getTitle() != null && !r.getTitle().isBlank(), miss),
            source(AcquisitionSourceType.AGGREGATOR, r -> r.getTitle() != null && !r.getTitle().isBlank(), miss),
            source(AcquisitionSourceType.TITLE_LOOKUP, r -> r.getTitle() != null && !r.getTitle().isBlank(), miss),
            source(AcquisitionSourceType.DOI_LOOKUP, r -> r.getDoi() != null && !r.getDoi().isBlank(), miss),
            source(AcquisitionSourceType.DIRECT_SOURCE, r -> r.getLink() != null && r.getLink().contains("cnki"), miss));
    }

    private AcquisitionSource source(
        AcquisitionSourceType type,
        Predicate<AcquisitionRequest> applicable,
        Function<AcquisitionContext, SourceOutcome> behavior
    ) {
        return new AcquisitionSource() {

            @Override
            public AcquisitionSourceType type() {
                return type;
            }

            @Override
            public boolean isApplicable(AcquisitionRequest request) {
                return applicable.test(request);
            }

            @Override
            public SourceOutcome attempt(AcquisitionContext context) {
                invoked.add(type);
                return behavior.apply(context);
            }

        };
    }

    private static AcquisitionRequest request(String title, String doi, String link) {
        return AcquisitionRequest.builder().title(title).doi(doi).link(link).build();
    }

}
