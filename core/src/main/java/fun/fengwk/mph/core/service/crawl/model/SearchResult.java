package fun.fengwk.mph.core.service.crawl.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the search result list.
 *
 * @author fengwk
 */
@Value
@Builder
public class SearchResult {

    String title;

    /**
     * Detail page link, may be null.
     */
    String link;

    String authors;
    String source;
    String pubDate;
    int citeCount;
    int downloadCount;

}
