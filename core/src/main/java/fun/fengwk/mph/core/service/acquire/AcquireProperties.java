package fun.fengwk.mph.core.service.acquire;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Document acquisition configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mph.acquire")
public class AcquireProperties {

    /**
     * Default directory downloaded documents are written to.
     */
    private String downloadDir = System.getProperty("user.home") + "/.my-paper-hub/downloads";

    /**
     * Max length of the derived file name stem.
     */
    private int maxFilenameLength = 100;

    /**
     * Minimum size in bytes of a plausible PDF.
     */
    private long minPdfBytes = 1000;

    /**
     * Connect timeout of HTTP transfers in milliseconds.
     */
    private long httpConnectTimeoutMs = 15000;

    /**
     * Overall timeout of one HTTP transfer in milliseconds.
     */
    private long httpRequestTimeoutMs = 60000;

    /**
     * Time allowed for a browser driven download to start in milliseconds.
     */
    private long browserDownloadStartTimeoutMs = 30000;

    /**
     * Overall timeout waiting for a browser driven download to complete in milliseconds.
     */
    private long browserDownloadTimeoutMs = 90000;

    /**
     * Poll interval of the download directory in milliseconds.
     */
    private long downloadPollIntervalMs = 1000;

    /**
     * Timeout waiting for a page element in milliseconds.
     */
    private long elementTimeoutMs = 5000;

    /**
     * Base delay after a navigation in milliseconds.
     */
    private long pageDelayMs = 2000;

    /**
     * Random jitter on top of the page delay in milliseconds.
     */
    private long pageJitterMs = 1000;

    /**
     * Base delay between batch items in milliseconds.
     */
    private long batchDelayMs = 3000;

    /**
     * Random jitter on top of the batch delay in milliseconds.
     */
    private long batchJitterMs = 2000;

    /**
     * Max candidate links tried per aggregator or web search source.
     */
    private int maxCandidateLinks = 3;

    /**
     * DOI and title lookup mirrors, tried in order.
     */
    private List<String> lookupMirrors = List.of(
        "https://sci-hub.ren",
        "https://sci-hub.se",
        "https://sci-hub.st",
        "https://sci-hub.ru",
        "https://sci-hub.shop",
        "https://sci-hub.wf"
    );

    /**
     * Page markers meaning the lookup mirror has no such article.
     */
    private List<String> lookupNotFoundMarkers = List.of("article not found", "статья не найдена");

    /**
     * Aggregator base url.
     */
    private String aggregatorUrl = "https://annas-archive.org";

    /**
     * Aggregator download link selectors.
     */
    private List<String> aggregatorDownloadSelectors = List.of(
        "a[href*='library.lol']", "a[href*='libgen']", "a.js-download-link");

    /**
     * Web search base url.
     */
    private String webSearchUrl = "https://scholar.google.com";

    /**
     * Web search PDF link selectors.
     */
    private List<String> webSearchLinkSelectors = List.of(".gs_or_ggsm a", ".gs_ggs a");

}
