package fun.fengwk.mph.core.service.acquire.support;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;
import fun.fengwk.mph.core.service.acquire.source.SourceOutcome;
import fun.fengwk.mph.core.service.browser.session.FetchSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.Set;

/**
 * Browser driven download: trigger, wait for completion, verify, move onto the target.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BrowserDownloader {

    private final AcquireProperties acquireProperties;
    private final DownloadCompletionWatcher completionWatcher;

    @Autowired
    public BrowserDownloader(AcquireProperties acquireProperties) {
        this(acquireProperties, new DownloadCompletionWatcher(acquireProperties.getDownloadPollIntervalMs()));
    }

    public BrowserDownloader(AcquireProperties acquireProperties, DownloadCompletionWatcher completionWatcher) {
        this.acquireProperties = acquireProperties;
        this.completionWatcher = completionWatcher;
    }

    public SourceOutcome download(FetchSession session, String url, Path target) {
        Path stagingDir = session.downloadDir();
        Set<Path> preexisting = DownloadCompletionWatcher.snapshot(stagingDir);
        if (!session.startDownload(url, acquireProperties.getBrowserDownloadStartTimeoutMs())) {
            return SourceOutcome.miss(AcquisitionFailure.TIMEOUT, "browser download not started: " + url);
        }

        Optional<Path> completed;
        try {
            completed = completionWatcher.awaitCompletion(
                stagingDir, preexisting, acquireProperties.getBrowserDownloadTimeoutMs());
        } finally {
            session.cancelDownloads();
        }
        if (completed.isEmpty()) {
            deleteNewFiles(stagingDir, preexisting);
            return SourceOutcome.miss(AcquisitionFailure.TIMEOUT, "browser download timeout: " + url);
        }

        Path file = completed.get();
        if (!PdfPayloads.isPlausiblePdf(file, null, acquireProperties.getMinPdfBytes())) {
            log.warn("browser download is not a pdf, url={}, file={}, size={}", url, file, PdfPayloads.sizeOf(file));
            deleteQuietly(file);
            return SourceOutcome.miss(AcquisitionFailure.VALIDATION, "downloaded file is not a pdf: " + url);
        }

        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            log.warn("move browser download failed, file={}, target={}, error={}", file, target, ex.getMessage());
            deleteQuietly(file);
            return SourceOutcome.miss(AcquisitionFailure.TRANSIENT_NETWORK, "move download failed: " + ex.getMessage());
        }
        log.info("browser download completed, url={}, target={}", url, target);
        return SourceOutcome.success(target, "browser download");
    }

    private void deleteNewFiles(Path dir, Set<Path> preexisting) {
        for (Path file : DownloadCompletionWatcher.snapshot(dir)) {
            if (!preexisting.contains(file)) {
                deleteQuietly(file);
            }
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("failed to delete rejected download, file={}, error={}", file, ex.getMessage());
        }
    }

}
