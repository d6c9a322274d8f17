package fun.fengwk.mph.core.service.acquire.impl;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.AcquisitionPipeline;
import fun.fengwk.mph.core.service.acquire.PaperAcquisitionService;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionResult;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionSourceType;
import fun.fengwk.mph.core.service.acquire.model.PaperDownloadRequest;
import fun.fengwk.mph.core.service.acquire.model.PaperDownloadResponse;
import fun.fengwk.mph.core.service.acquire.source.AcquisitionSource;
import fun.fengwk.mph.core.service.browser.session.FetchSession;
import fun.fengwk.mph.core.service.browser.session.FetchSessionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Paper acquisition service implementation, one fetch session per request.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaperAcquisitionServiceImpl implements PaperAcquisitionService {

    private static final int MAX_BATCH_SIZE = 50;

    private final FetchSessionFactory fetchSessionFactory;
    private final List<AcquisitionSource> acquisitionSources;
    private final AcquireProperties acquireProperties;

    @Override
    public PaperDownloadResponse download(PaperDownloadRequest request) {
        long startAt = System.currentTimeMillis();
        try {
            validateRequest(request);
            List<AcquisitionSourceType> sources = parseSources(request.getSources());
            Path downloadDir = Paths.get(StringUtils.defaultIfBlank(request.getDownloadDir(),
                acquireProperties.getDownloadDir()).trim()).toAbsolutePath();
            Files.createDirectories(downloadDir);
            boolean stopOnFailure = request.getStopOnFailure() != null && request.getStopOnFailure();

            List<AcquisitionResult> results;
            try (FetchSession session = fetchSessionFactory.open()) {
                AcquisitionPipeline pipeline = new AcquisitionPipeline(
                    session, acquisitionSources, acquireProperties, downloadDir);
                results = pipeline.acquireBatch(request.getItems(), sources, stopOnFailure);
            }

            int successCount = (int) results.stream().filter(AcquisitionResult::isSuccess).count();
            log.info("paper download finished, items={}, processed={}, success={}",
                request.getItems().size(), results.size(), successCount);
            return PaperDownloadResponse.builder()
                .statusCode(200)
                .downloadDir(downloadDir.toString())
                .results(results)
                .successCount(successCount)
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (IllegalArgumentException ex) {
            log.warn("paper download request invalid, error={}", ex.getMessage());
            return PaperDownloadResponse.builder()
                .statusCode(400)
                .results(List.of())
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (Exception ex) {
            log.warn("paper download failed, error={}", ex.getMessage(), ex);
            return PaperDownloadResponse.builder()
                .statusCode(500)
                .results(List.of())
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        }
    }

    private void validateRequest(PaperDownloadRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        List<AcquisitionRequest> items = request.getItems();
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("items is empty");
        }
        if (items.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("too many items, max " + MAX_BATCH_SIZE);
        }
    }

    private List<AcquisitionSourceType> parseSources(List<String> sources) {
        List<AcquisitionSourceType> types = new ArrayList<>();
        if (sources == null) {
            return types;
        }
        for (String source : sources) {
            if (StringUtils.isNotBlank(source)) {
                types.add(AcquisitionSourceType.fromValue(source));
            }
        }
        return types;
    }

}
