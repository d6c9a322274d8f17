package fun.fengwk.mph.core.service.crawl;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Search and detail crawl configuration. Selector lists are tried in order.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mph.crawl")
public class CrawlProperties {

    /**
     * Host used to resolve relative links.
     */
    private String host = "https://kns.cnki.net";

    /**
     * Domain fragment identifying links of the literature portal.
     */
    private String originDomain = "cnki";

    /**
     * Search page url.
     */
    private String searchUrl = "https://kns.cnki.net/kns8s/search";

    /**
     * Search class id query parameter.
     */
    private String classId = "WD0FTY92";

    /**
     * Default max results of one search.
     */
    private int defaultMaxResults = 20;

    /**
     * Base delay after a navigation in milliseconds.
     */
    private long requestDelayMs = 2000;

    /**
     * Random jitter added on top of the base delay in milliseconds.
     */
    private long requestJitterMs = 1000;

    /**
     * Wait after clicking the sort control in milliseconds.
     */
    private long sortSettleMs = 2000;

    /**
     * Timeout waiting for result rows in milliseconds.
     */
    private long rowWaitTimeoutMs = 10000;

    /**
     * Timeout waiting for a single detail field or control in milliseconds.
     */
    private long elementTimeoutMs = 3000;

    /**
     * Sort control selector templates, {@code %s} is the sort id.
     */
    private List<String> sortSelectors = List.of("#orderList li#%s", "#%s");

    /**
     * Result row selectors.
     */
    private List<String> rowSelectors = List.of(".result-table-list tbody tr", "#gridTable tbody tr");

    /**
     * Row title link selectors.
     */
    private List<String> rowTitleSelectors = List.of(".name a", "td.name a");

    /**
     * Row author selectors.
     */
    private List<String> rowAuthorSelectors = List.of(".author", "td.author");

    /**
     * Row source selectors.
     */
    private List<String> rowSourceSelectors = List.of(".source", "td.source");

    /**
     * Row publication date selectors.
     */
    private List<String> rowDateSelectors = List.of(".date", "td.date");

    /**
     * Zero based cell index of the citation counter.
     */
    private int citeCountCellIndex = 6;

    /**
     * Zero based cell index of the download counter.
     */
    private int downloadCountCellIndex = 7;

    /**
     * Detail title selectors.
     */
    private List<String> detailTitleSelectors = List.of(".wx-tit h1", "h1.title");

    /**
     * Detail author selectors.
     */
    private List<String> detailAuthorSelectors = List.of(".author", "#authorpart");

    /**
     * Detail organization selectors.
     */
    private List<String> detailOrganizationSelectors = List.of(".orgn", ".author-orgn");

    /**
     * Detail abstract selectors.
     */
    private List<String> detailAbstractSelectors = List.of(".abstract-text", "#ChDivSummary");

    /**
     * Detail keyword selectors.
     */
    private List<String> detailKeywordSelectors = List.of(".keywords", "p.keywords");

    /**
     * Structural markers of the block page.
     */
    private List<String> blockMarkers = List.of("#verify-bar-box", ".verify-wrap", ".captcha-container", ".nc-container");

    /**
     * Case insensitive title keywords of the block page.
     */
    private List<String> blockTitleKeywords = List.of("验证", "captcha", "verify");

    /**
     * Probe timeout per block marker in milliseconds.
     */
    private long blockMarkerTimeoutMs = 500;

}
