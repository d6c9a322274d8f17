package fun.fengwk.mph.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import org.apache.commons.lang3.StringUtils;

/**
 * Stealth script helper for browser context.
 *
 * <p>Masks the automation fingerprints the literature portal's slider check looks at.
 *
 * @author fengwk
 */
public final class BrowserStealthSupport {

    static final String DEFAULT_STEALTH_SCRIPT = """
        (() => {
          try {
            Object.defineProperty(navigator, 'webdriver', { get: () => undefined });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'languages', { get: () => ['zh-CN', 'zh', 'en'] });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'plugins', { get: () => [1, 2, 3, 4, 5] });
          } catch (e) {}
          try {
            window.chrome = window.chrome || { runtime: {}, loadTimes: () => ({}), csi: () => ({}) };
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'platform', { get: () => 'Win32' });
            Object.defineProperty(navigator, 'hardwareConcurrency', { get: () => 8 });
          } catch (e) {}
          try {
            if (!window.outerWidth || !window.outerHeight) {
              Object.defineProperty(window, 'outerWidth', { get: () => window.innerWidth });
              Object.defineProperty(window, 'outerHeight', { get: () => window.innerHeight + 85 });
            }
          } catch (e) {}
          try {
            const getParameter = WebGLRenderingContext.prototype.getParameter;
            WebGLRenderingContext.prototype.getParameter = function (parameter) {
              if (parameter === 37445) {
                return 'Intel Inc.';
              }
              if (parameter === 37446) {
                return 'Intel Iris OpenGL Engine';
              }
              return getParameter.call(this, parameter);
            };
          } catch (e) {}
          try {
            const originalQuery = window.navigator.permissions && window.navigator.permissions.query;
            if (originalQuery) {
              window.navigator.permissions.query = (parameters) => (
                parameters && parameters.name === 'notifications'
                  ? Promise.resolve({ state: Notification.permission })
                  : originalQuery(parameters)
              );
            }
          } catch (e) {}
        })();
        """;

    private BrowserStealthSupport() {
    }

    public static void apply(BrowserContext context, BrowserProperties properties) {
        String script = properties.resolveStealthScript();
        if (StringUtils.isBlank(script)) {
            return;
        }
        context.addInitScript(script);
    }

}
