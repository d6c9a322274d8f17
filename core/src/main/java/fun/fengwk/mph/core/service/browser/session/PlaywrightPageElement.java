package fun.fengwk.mph.core.service.browser.session;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.PlaywrightException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Page element backed by a Playwright element handle.
 *
 * @author fengwk
 */
@Slf4j
class PlaywrightPageElement implements PageElement {

    private static final double CLICK_TIMEOUT_MS = 5000;

    private final ElementHandle handle;

    PlaywrightPageElement(ElementHandle handle) {
        this.handle = handle;
    }

    @Override
    public String text() {
        try {
            String text = handle.innerText();
            return text == null ? "" : text.trim();
        } catch (PlaywrightException ex) {
            log.debug("read element text failed, error={}", ex.getMessage());
            return "";
        }
    }

    @Override
    public String attribute(String name) {
        try {
            return handle.getAttribute(name);
        } catch (PlaywrightException ex) {
            log.debug("read element attribute failed, name={}, error={}", name, ex.getMessage());
            return null;
        }
    }

    @Override
    public Optional<PageElement> findElement(String selector) {
        try {
            ElementHandle child = handle.querySelector(selector);
            return child == null ? Optional.empty() : Optional.of(new PlaywrightPageElement(child));
        } catch (PlaywrightException ex) {
            log.debug("query child element failed, selector={}, error={}", selector, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<PageElement> findElements(String selector) {
        try {
            return wrap(handle.querySelectorAll(selector));
        } catch (PlaywrightException ex) {
            log.debug("query child elements failed, selector={}, error={}", selector, ex.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean click() {
        try {
            handle.click(new ElementHandle.ClickOptions().setTimeout(CLICK_TIMEOUT_MS));
            return true;
        } catch (PlaywrightException ex) {
            log.debug("click element failed, error={}", ex.getMessage());
            return false;
        }
    }

    static List<PageElement> wrap(List<ElementHandle> handles) {
        if (handles == null || handles.isEmpty()) {
            return List.of();
        }
        List<PageElement> elements = new ArrayList<>(handles.size());
        for (ElementHandle handle : handles) {
            elements.add(new PlaywrightPageElement(handle));
        }
        return elements;
    }

}
