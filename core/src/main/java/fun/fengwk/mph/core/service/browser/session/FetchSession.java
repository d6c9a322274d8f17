package fun.fengwk.mph.core.service.browser.session;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One automation client handle with a session scoped profile and download directory.
 *
 * <p>Every primitive is bounded by a timeout and reports failure through its return value instead of throwing.
 * A session is single threaded and must be closed by its owner.
 *
 * @author fengwk
 */
public interface FetchSession extends AutoCloseable {

    SessionBlockState blockState();

    /**
     * Navigate the page and wait for the DOM to load.
     *
     * @return false when navigation failed or timed out
     */
    boolean navigate(String url);

    /**
     * Wait up to {@code timeoutMs} for the first element matching the selector.
     */
    Optional<PageElement> findElement(String selector, long timeoutMs);

    /**
     * Wait up to {@code timeoutMs} for the selector, then return every match.
     */
    List<PageElement> findElements(String selector, long timeoutMs);

    String title();

    String content();

    String currentUrl();

    /**
     * Cookies of the browser context as name to value.
     */
    Map<String, String> cookies();

    String userAgent();

    /**
     * Directory where browser driven downloads land.
     */
    Path downloadDir();

    /**
     * Trigger a browser driven download of the url into {@link #downloadDir()}. Returns as soon as the download has
     * started, completion is observed by polling the download directory.
     *
     * @return false when no download started within the timeout
     */
    boolean startDownload(String url, long timeoutMs);

    /**
     * Cancel every started download that has not finished. Finished downloads are left alone.
     */
    void cancelDownloads();

    /**
     * Idle the page for the given delay.
     */
    void pause(long delayMs);

    /**
     * Idempotent close, releases the automation handle and deletes the session directory.
     */
    @Override
    void close();

}
