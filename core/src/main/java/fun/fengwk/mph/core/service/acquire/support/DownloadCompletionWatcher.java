package fun.fengwk.mph.core.service.acquire.support;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Polls a download directory until a browser driven download has completed.
 *
 * <p>A download is complete when no in-progress artifact remains and the newest new file keeps the same non-zero
 * size across two consecutive samples.
 *
 * @author fengwk
 */
@Slf4j
public class DownloadCompletionWatcher {

    private static final List<String> IN_PROGRESS_SUFFIXES = List.of(".crdownload", ".part", ".download", ".tmp");

    private final long pollIntervalMs;

    public DownloadCompletionWatcher(long pollIntervalMs) {
        this.pollIntervalMs = Math.max(1, pollIntervalMs);
    }

    /**
     * Wait for a completed file that was not in {@code preexisting}.
     *
     * @return the completed file, empty on timeout
     */
    public Optional<Path> awaitCompletion(Path dir, Set<Path> preexisting, long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        Path lastCandidate = null;
        long lastSize = -1;
        while (System.currentTimeMillis() < deadline) {
            List<Path> files = listFiles(dir);
            boolean inProgress = files.stream().anyMatch(DownloadCompletionWatcher::isInProgressArtifact);
            if (!inProgress) {
                Optional<Path> candidate = files.stream()
                    .filter(file -> !preexisting.contains(file))
                    .max(Comparator.comparing(DownloadCompletionWatcher::lastModified));
                if (candidate.isPresent()) {
                    long size = PdfPayloads.sizeOf(candidate.get());
                    if (size > 0 && candidate.get().equals(lastCandidate) && size == lastSize) {
                        return candidate;
                    }
                    lastCandidate = candidate.get();
                    lastSize = size;
                }
            } else {
                lastCandidate = null;
                lastSize = -1;
            }
            if (!sleep()) {
                return Optional.empty();
            }
        }
        log.warn("download did not complete in time, dir={}, timeoutMs={}", dir, timeoutMs);
        return Optional.empty();
    }

    public static Set<Path> snapshot(Path dir) {
        return listFiles(dir).stream().collect(Collectors.toSet());
    }

    public static boolean isInProgressArtifact(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return IN_PROGRESS_SUFFIXES.stream().anyMatch(name::endsWith);
    }

    private static List<Path> listFiles(Path dir) {
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile).collect(Collectors.toList());
        } catch (IOException ex) {
            log.debug("list download dir failed, dir={}, error={}", dir, ex.getMessage());
            return List.of();
        }
    }

    private static FileTime lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException ex) {
            return FileTime.fromMillis(0);
        }
    }

    private boolean sleep() {
        try {
            Thread.sleep(pollIntervalMs);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

}
