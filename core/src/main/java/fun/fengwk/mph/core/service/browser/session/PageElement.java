package fun.fengwk.mph.core.service.browser.session;

import java.util.List;
import java.util.Optional;

/**
 * Read only view over one element of the current page.
 *
 * @author fengwk
 */
public interface PageElement {

    /**
     * Rendered text, empty when unavailable.
     */
    String text();

    /**
     * Attribute value, null when absent.
     */
    String attribute(String name);

    Optional<PageElement> findElement(String selector);

    List<PageElement> findElements(String selector);

    /**
     * Click the element.
     *
     * @return false when the click failed
     */
    boolean click();

}
