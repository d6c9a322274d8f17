package fun.fengwk.mph.core.service.browser.session;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import fun.fengwk.mph.core.service.browser.BrowserProperties;
import fun.fengwk.mph.core.service.browser.BrowserStealthSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Launches a persistent Chromium context per session with a throwaway profile directory.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightFetchSessionFactory implements FetchSessionFactory {

    private final BrowserProperties browserProperties;

    @Override
    public FetchSession open() {
        Path sessionDir = createSessionDir();
        Path profileDir = sessionDir.resolve("profile");
        Path downloadDir = sessionDir.resolve("downloads");
        Playwright playwright = null;
        try {
            Files.createDirectories(profileDir);
            Files.createDirectories(downloadDir);
            String userAgent = browserProperties.resolveUserAgent();
            playwright = Playwright.create();
            BrowserContext context = playwright.chromium()
                .launchPersistentContext(profileDir, buildLaunchOptions(userAgent, downloadDir));
            context.setDefaultTimeout(browserProperties.getDefaultTimeoutMs());
            BrowserStealthSupport.apply(context, browserProperties);
            log.debug("fetch session opened, dir={}", sessionDir);
            return new PlaywrightFetchSession(
                sessionDir, downloadDir, playwright, context, userAgent, browserProperties.getNavigateTimeoutMs());
        } catch (IOException ex) {
            closeQuietly(playwright);
            throw new UncheckedIOException("failed to prepare session dir: " + sessionDir, ex);
        } catch (RuntimeException ex) {
            closeQuietly(playwright);
            throw new IllegalStateException("failed to launch browser session: " + ex.getMessage(), ex);
        }
    }

    private Path createSessionDir() {
        Path root = Paths.get(browserProperties.getSessionDataRoot());
        return root.resolve("session-" + UUID.randomUUID());
    }

    private BrowserType.LaunchPersistentContextOptions buildLaunchOptions(String userAgent, Path downloadDir) {
        BrowserType.LaunchPersistentContextOptions options = new BrowserType.LaunchPersistentContextOptions()
            .setHeadless(browserProperties.isHeadless())
            .setAcceptDownloads(true)
            .setDownloadsPath(downloadDir)
            .setViewportSize(browserProperties.getViewportWidth(), browserProperties.getViewportHeight());
        if (browserProperties.isIgnoreAllDefaultArgs()) {
            options.setIgnoreAllDefaultArgs(true);
        } else if (browserProperties.getIgnoreDefaultArgs() != null
            && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (StringUtils.isNotBlank(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.isNotBlank(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        if (StringUtils.isNotBlank(userAgent)) {
            options.setUserAgent(userAgent);
        }
        if (StringUtils.isNotBlank(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.isNotBlank(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }
        Map<String, String> headers = new LinkedHashMap<>();
        if (browserProperties.getExtraHeaders() != null) {
            headers.putAll(browserProperties.getExtraHeaders());
        }
        if (StringUtils.isNotBlank(browserProperties.getAcceptLanguage())) {
            headers.put("Accept-Language", browserProperties.getAcceptLanguage());
        }
        if (!headers.isEmpty()) {
            options.setExtraHTTPHeaders(headers);
        }
        if (StringUtils.isNotBlank(browserProperties.getProxyServer())) {
            Proxy proxy = new Proxy(browserProperties.getProxyServer());
            if (StringUtils.isNotBlank(browserProperties.getProxyUsername())) {
                proxy.setUsername(browserProperties.getProxyUsername());
                proxy.setPassword(browserProperties.getProxyPassword());
            }
            options.setProxy(proxy);
        }
        return options;
    }

    private void closeQuietly(Playwright playwright) {
        if (playwright == null) {
            return;
        }
        try {
            playwright.close();
        } catch (Exception ex) {
            log.warn("failed to close playwright after launch failure", ex);
        }
    }

}
