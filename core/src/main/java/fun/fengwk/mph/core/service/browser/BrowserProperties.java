package fun.fengwk.mph.core.service.browser;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Browser session shared configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mph.browser")
public class BrowserProperties {

    /**
     * Root directory for session scoped profile and download staging directories.
     */
    private String sessionDataRoot = System.getProperty("java.io.tmpdir") + "/my-paper-hub/sessions";

    /**
     * Whether sessions run in headless mode.
     */
    private boolean headless = true;

    /**
     * Optional fixed user agent for browser context.
     */
    private String userAgent = "";

    /**
     * User agent pool for random rotation.
     */
    private List<String> userAgents = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
    );

    /**
     * Accept-Language header value.
     */
    private String acceptLanguage = "zh-CN,zh;q=0.9,en;q=0.8";

    /**
     * Locale for browser context.
     */
    private String locale = "zh-CN";

    /**
     * Timezone id for browser context.
     */
    private String timezoneId = "Asia/Shanghai";

    /**
     * Viewport width.
     */
    private int viewportWidth = 1920;

    /**
     * Viewport height.
     */
    private int viewportHeight = 1080;

    /**
     * Extra headers for browser context.
     */
    private Map<String, String> extraHeaders = Map.of();

    /**
     * Proxy server, for example http://proxy:8080.
     */
    private String proxyServer = "";

    /**
     * Proxy username.
     */
    private String proxyUsername = "";

    /**
     * Proxy password.
     */
    private String proxyPassword = "";

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of("--disable-blink-features=AutomationControlled");

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    /**
     * Ignore all default args for browser launch.
     */
    private boolean ignoreAllDefaultArgs = false;

    /**
     * Page navigate timeout in milliseconds.
     */
    private long navigateTimeoutMs = 30000;

    /**
     * Default timeout for page operations in milliseconds.
     */
    private long defaultTimeoutMs = 30000;

    /**
     * Whether to enable stealth script.
     */
    private boolean stealthEnabled = true;

    /**
     * Optional stealth script, empty uses default.
     */
    private String stealthScript = "";

    public String resolveStealthScript() {
        if (!stealthEnabled) {
            return "";
        }
        if (StringUtils.isNotBlank(stealthScript)) {
            return stealthScript;
        }
        return BrowserStealthSupport.DEFAULT_STEALTH_SCRIPT;
    }

    public String resolveUserAgent() {
        if (StringUtils.isNotBlank(userAgent)) {
            return userAgent;
        }
        if (userAgents == null || userAgents.isEmpty()) {
            return "";
        }
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

}
