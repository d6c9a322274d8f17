package fun.fengwk.mph.core.service.acquire;

import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionResult;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionSourceType;
import fun.fengwk.mph.core.service.acquire.model.SourceAttempt;
import fun.fengwk.mph.core.service.acquire.source.AcquisitionContext;
import fun.fengwk.mph.core.service.acquire.source.AcquisitionSource;
import fun.fengwk.mph.core.service.acquire.source.SourceOutcome;
import fun.fengwk.mph.core.service.acquire.support.FilenameSanitizer;
import fun.fengwk.mph.core.service.acquire.support.PdfPayloads;
import fun.fengwk.mph.core.service.browser.session.FetchSession;
import fun.fengwk.mph.core.service.browser.session.RequestPacer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tries an ordered list of acquisition sources against one article until a verified PDF is delivered.
 *
 * <p>Holds no state across requests. One pipeline drives one fetch session and is not thread safe.
 *
 * @author fengwk
 */
@Slf4j
public class AcquisitionPipeline {

    private static final String STAGING_PREFIX = ".staging-";

    private final FetchSession session;
    private final Map<AcquisitionSourceType, AcquisitionSource> sources;
    private final AcquireProperties acquireProperties;
    private final Path downloadDir;
    private final RequestPacer pagePacer;
    private final RequestPacer batchPacer;
    private final Clock clock;

    public AcquisitionPipeline(
        FetchSession session,
        List<AcquisitionSource> sources,
        AcquireProperties acquireProperties,
        Path downloadDir
    ) {
        this(session, sources, acquireProperties, downloadDir,
            new RequestPacer(acquireProperties.getPageDelayMs(), acquireProperties.getPageJitterMs()),
            new RequestPacer(acquireProperties.getBatchDelayMs(), acquireProperties.getBatchJitterMs()),
            Clock.systemDefaultZone());
    }

    public AcquisitionPipeline(
        FetchSession session,
        List<AcquisitionSource> sources,
        AcquireProperties acquireProperties,
        Path downloadDir,
        RequestPacer pagePacer,
        RequestPacer batchPacer,
        Clock clock
    ) {
        this.session = session;
        this.sources = new EnumMap<>(AcquisitionSourceType.class);
        for (AcquisitionSource source : sources) {
            this.sources.put(source.type(), source);
        }
        this.acquireProperties = acquireProperties;
        this.downloadDir = downloadDir;
        this.pagePacer = pagePacer;
        this.batchPacer = batchPacer;
        this.clock = clock;
    }

    /**
     * Sources that will be attempted for the request, in attempt order.
     *
     * @param requested explicit order, null or empty means the default order
     */
    public List<AcquisitionSourceType> planSources(AcquisitionRequest request, List<AcquisitionSourceType> requested) {
        List<AcquisitionSourceType> order = requested == null || requested.isEmpty()
            ? Arrays.asList(AcquisitionSourceType.values())
            : requested;
        List<AcquisitionSourceType> plan = new ArrayList<>();
        for (AcquisitionSourceType type : order) {
            AcquisitionSource source = sources.get(type);
            if (source == null) {
                log.warn("acquisition source not registered, source={}", type.getValue());
                continue;
            }
            if (!plan.contains(type) && source.isApplicable(request)) {
                plan.add(type);
            }
        }
        return plan;
    }

    public AcquisitionResult acquire(AcquisitionRequest request, List<AcquisitionSourceType> requested) {
        if (request == null || (StringUtils.isBlank(request.getTitle()) && StringUtils.isBlank(request.getDoi()))) {
            return AcquisitionResult.builder()
                .success(false)
                .message("title and doi are both missing")
                .title(request == null ? null : request.getTitle())
                .doi(request == null ? null : request.getDoi())
                .attempts(List.of())
                .build();
        }

        List<AcquisitionSourceType> plan = planSources(request, requested);
        if (plan.isEmpty()) {
            return failed(request, List.of(), "no applicable acquisition source");
        }

        String stem = FilenameSanitizer.deriveStem(request, acquireProperties.getMaxFilenameLength(), clock);
        Path stagingDir;
        try {
            Files.createDirectories(downloadDir);
            stagingDir = Files.createTempDirectory(downloadDir, STAGING_PREFIX);
        } catch (IOException ex) {
            log.warn("create staging dir failed, downloadDir={}, error={}", downloadDir, ex.getMessage());
            return failed(request, List.of(), "download dir not writable: " + ex.getMessage());
        }

        try {
            return acquireStaged(request, plan, stem, stagingDir.resolve(stem + ".pdf"));
        } finally {
            deleteRecursivelyQuietly(stagingDir);
        }
    }

    private AcquisitionResult acquireStaged(
        AcquisitionRequest request,
        List<AcquisitionSourceType> plan,
        String stem,
        Path staging
    ) {
        AcquisitionContext context = AcquisitionContext.builder()
            .request(request)
            .session(session)
            .target(staging)
            .pagePacer(pagePacer)
            .build();

        log.info("acquire start, title={}, doi={}, plan={}", request.getTitle(), request.getDoi(), plan);
        List<SourceAttempt> attempts = new ArrayList<>();
        for (int i = 0; i < plan.size(); i++) {
            AcquisitionSourceType type = plan.get(i);
            SourceOutcome outcome = attemptSource(sources.get(type), context);

            if (outcome.success() && PdfPayloads.isVerifiedPdf(staging)) {
                Optional<Path> target = promote(staging, stem);
                if (target.isPresent() && PdfPayloads.isVerifiedPdf(target.get())) {
                    attempts.add(SourceAttempt.builder().source(type).success(true).message(outcome.message()).build());
                    log.info("acquire succeeded, source={}, target={}", type.getValue(), target.get());
                    return AcquisitionResult.builder()
                        .success(true)
                        .sourceUsed(type)
                        .filepath(target.get().toAbsolutePath().toString())
                        .message("downloaded from " + type.getValue())
                        .title(request.getTitle())
                        .doi(request.getDoi())
                        .attempts(attempts)
                        .build();
                }
                target.ifPresent(this::deleteQuietly);
                outcome = SourceOutcome.miss(AcquisitionFailure.TRANSIENT_NETWORK, "failed to store the downloaded file");
            } else if (outcome.success()) {
                outcome = SourceOutcome.miss(AcquisitionFailure.VALIDATION, "delivered file failed pdf verification");
            }
            attempts.add(SourceAttempt.builder()
                .source(type)
                .success(false)
                .failure(outcome.failure())
                .message(outcome.message())
                .build());
            log.info("acquire source missed, source={}, failure={}, message={}",
                type.getValue(), outcome.failure(), outcome.message());
            deleteQuietly(staging);

            if (i < plan.size() - 1) {
                pagePacer.pace(session);
            }
        }

        String reasons = attempts.stream()
            .map(attempt -> attempt.getSource().getValue() + ": " + attempt.getMessage())
            .collect(Collectors.joining("; "));
        return failed(request, attempts, "all acquisition sources failed [" + reasons + "]");
    }

    /**
     * Acquire sequentially with a randomized delay between items.
     *
     * @param stopOnFailure halt at the first failed item, the result list is then shorter than the input
     */
    public List<AcquisitionResult> acquireBatch(
        List<AcquisitionRequest> requests,
        List<AcquisitionSourceType> requested,
        boolean stopOnFailure
    ) {
        List<AcquisitionResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            AcquisitionResult result = acquire(requests.get(i), requested);
            results.add(result);
            if (!result.isSuccess() && stopOnFailure) {
                log.info("batch stopped on failure, index={}, total={}", i, requests.size());
                break;
            }
            if (i < requests.size() - 1) {
                batchPacer.pace(session);
            }
        }
        return results;
    }

    private SourceOutcome attemptSource(AcquisitionSource source, AcquisitionContext context) {
        try {
            SourceOutcome outcome = source.attempt(context);
            return outcome == null
                ? SourceOutcome.miss(AcquisitionFailure.NOT_FOUND, "no outcome")
                : outcome;
        } catch (Exception ex) {
            log.warn("acquisition source failed, source={}, error={}", source.type().getValue(), ex.getMessage(), ex);
            return SourceOutcome.miss(AcquisitionFailure.TRANSIENT_NETWORK, "error: " + ex.getMessage());
        }
    }

    private AcquisitionResult failed(AcquisitionRequest request, List<SourceAttempt> attempts, String message) {
        return AcquisitionResult.builder()
            .success(false)
            .message(message)
            .title(request.getTitle())
            .doi(request.getDoi())
            .attempts(attempts)
            .build();
    }

    /**
     * Move a verified staging file onto {@code {stem}.pdf}, or onto {@code {stem}_N.pdf} when that name is taken.
     * Existing files in the download directory are never replaced.
     */
    private Optional<Path> promote(Path staging, String stem) {
        Path target = downloadDir.resolve(stem + ".pdf");
        for (int n = 1; Files.exists(target); n++) {
            target = downloadDir.resolve(stem + "_" + n + ".pdf");
        }
        try {
            return Optional.of(Files.move(staging, target));
        } catch (IOException ex) {
            log.warn("promote staged download failed, staging={}, target={}, error={}", staging, target, ex.getMessage());
            return Optional.empty();
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("failed to delete rejected download, file={}, error={}", file, ex.getMessage());
        }
    }

    private void deleteRecursivelyQuietly(Path dir) {
        try (Stream<Path> stream = Files.walk(dir)) {
            stream.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
        } catch (IOException ex) {
            log.warn("failed to cleanup staging dir, dir={}, error={}", dir, ex.getMessage());
        }
    }

}
