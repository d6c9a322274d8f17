package fun.fengwk.mph.core.service.browser.session;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Download;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Fetch session that owns one Playwright instance with a persistent browser context.
 *
 * <p>Close is idempotent and releases resources in strict order: context, playwright, session directory.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightFetchSession implements FetchSession {

    private final Path sessionDir;
    private final Path downloadDir;
    private final Playwright playwright;
    private final BrowserContext browserContext;
    private final Page page;
    private final String userAgent;
    private final long navigateTimeoutMs;
    private final SessionBlockState blockState = new SessionBlockState();
    private final List<Download> pendingDownloads = new ArrayList<>();
    private volatile boolean closed = false;

    public PlaywrightFetchSession(
        Path sessionDir,
        Path downloadDir,
        Playwright playwright,
        BrowserContext browserContext,
        String userAgent,
        long navigateTimeoutMs
    ) {
        this.sessionDir = sessionDir;
        this.downloadDir = downloadDir;
        this.playwright = playwright;
        this.browserContext = browserContext;
        List<Page> pages = browserContext.pages();
        this.page = pages.isEmpty() ? browserContext.newPage() : pages.get(0);
        this.userAgent = userAgent;
        this.navigateTimeoutMs = navigateTimeoutMs;
    }

    @Override
    public SessionBlockState blockState() {
        return blockState;
    }

    @Override
    public boolean navigate(String url) {
        ensureOpen();
        try {
            page.navigate(url, new Page.NavigateOptions()
                .setTimeout(navigateTimeoutMs)
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            return true;
        } catch (TimeoutError ex) {
            log.warn("navigate timeout, url={}, timeoutMs={}", url, navigateTimeoutMs);
            return false;
        } catch (PlaywrightException ex) {
            log.warn("navigate failed, url={}, error={}", url, ex.getMessage());
            return false;
        }
    }

    @Override
    public Optional<PageElement> findElement(String selector, long timeoutMs) {
        ensureOpen();
        try {
            ElementHandle handle = page.waitForSelector(selector, new Page.WaitForSelectorOptions()
                .setTimeout(timeoutMs)
                .setState(WaitForSelectorState.ATTACHED));
            return handle == null ? Optional.empty() : Optional.of(new PlaywrightPageElement(handle));
        } catch (TimeoutError ex) {
            return Optional.empty();
        } catch (PlaywrightException ex) {
            log.debug("find element failed, selector={}, error={}", selector, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<PageElement> findElements(String selector, long timeoutMs) {
        if (findElement(selector, timeoutMs).isEmpty()) {
            return List.of();
        }
        try {
            return PlaywrightPageElement.wrap(page.querySelectorAll(selector));
        } catch (PlaywrightException ex) {
            log.debug("find elements failed, selector={}, error={}", selector, ex.getMessage());
            return List.of();
        }
    }

    @Override
    public String title() {
        ensureOpen();
        try {
            return StringUtils.defaultString(page.title());
        } catch (PlaywrightException ex) {
            log.debug("read page title failed, error={}", ex.getMessage());
            return "";
        }
    }

    @Override
    public String content() {
        ensureOpen();
        try {
            return StringUtils.defaultString(page.content());
        } catch (PlaywrightException ex) {
            log.debug("read page content failed, error={}", ex.getMessage());
            return "";
        }
    }

    @Override
    public String currentUrl() {
        ensureOpen();
        return StringUtils.defaultString(page.url());
    }

    @Override
    public Map<String, String> cookies() {
        ensureOpen();
        Map<String, String> cookies = new LinkedHashMap<>();
        try {
            for (Cookie cookie : browserContext.cookies()) {
                cookies.put(cookie.name, cookie.value);
            }
        } catch (PlaywrightException ex) {
            log.debug("read cookies failed, error={}", ex.getMessage());
        }
        return cookies;
    }

    @Override
    public String userAgent() {
        return userAgent;
    }

    @Override
    public Path downloadDir() {
        return downloadDir;
    }

    @Override
    public boolean startDownload(String url, long timeoutMs) {
        ensureOpen();
        try {
            Download download = page.waitForDownload(new Page.WaitForDownloadOptions().setTimeout(timeoutMs), () -> {
                try {
                    page.navigate(url, new Page.NavigateOptions().setTimeout(timeoutMs));
                } catch (PlaywrightException ex) {
                    // Navigating to an attachment aborts the navigation once the download starts.
                    log.debug("download navigation interrupted, url={}, error={}", url, ex.getMessage());
                }
            });
            pendingDownloads.add(download);
            log.debug("browser download started, url={}, suggestedFilename={}", url, download.suggestedFilename());
            return true;
        } catch (TimeoutError ex) {
            log.warn("browser download not started, url={}, timeoutMs={}", url, timeoutMs);
            return false;
        } catch (PlaywrightException ex) {
            log.warn("browser download failed, url={}, error={}", url, ex.getMessage());
            return false;
        }
    }

    @Override
    public void cancelDownloads() {
        if (closed) {
            pendingDownloads.clear();
            return;
        }
        for (Download download : pendingDownloads) {
            try {
                download.cancel();
            } catch (PlaywrightException ex) {
                log.debug("cancel download failed, url={}, error={}", download.url(), ex.getMessage());
            }
        }
        pendingDownloads.clear();
    }

    @Override
    public void pause(long delayMs) {
        if (delayMs <= 0 || closed) {
            return;
        }
        try {
            page.waitForTimeout(delayMs);
        } catch (PlaywrightException ex) {
            log.debug("pause interrupted, delayMs={}, error={}", delayMs, ex.getMessage());
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        cancelDownloads();
        closed = true;

        try {
            if (browserContext != null) {
                browserContext.close();
            }
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("browser context already closed, dir={}, skip close", sessionDir);
            } else {
                log.warn("failed to close browser context, dir={}", sessionDir, ex);
            }
        }

        try {
            if (playwright != null) {
                playwright.close();
            }
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("playwright already closed, dir={}, skip close", sessionDir);
            } else {
                log.warn("failed to close playwright, dir={}", sessionDir, ex);
            }
        }

        deleteSessionDirQuietly();
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("fetch session is closed");
        }
    }

    private void deleteSessionDirQuietly() {
        if (sessionDir == null || !Files.exists(sessionDir)) {
            return;
        }
        // Delete children first, then root directory.
        try (Stream<Path> stream = Files.walk(sessionDir)) {
            stream
                .sorted(Comparator.reverseOrder())
                .forEach(path -> {
                    try {
                        Files.deleteIfExists(path);
                    } catch (Exception ex) {
                        throw new IllegalStateException("failed to delete path: " + path, ex);
                    }
                });
        } catch (Exception ex) {
            log.warn("failed to cleanup session dir, dir={}", sessionDir, ex);
        }
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

}
