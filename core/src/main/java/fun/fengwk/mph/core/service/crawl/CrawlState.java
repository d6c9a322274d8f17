package fun.fengwk.mph.core.service.crawl;

/**
 * Lifecycle of a {@link SearchCrawler}.
 *
 * @author fengwk
 */
public enum CrawlState {

    IDLE,
    SEARCHING,
    BLOCKED,
    RESULTS_PARSED,
    DETAIL_FETCHING,
    DONE

}
