package fun.fengwk.mph.core.service.crawl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Search result enriched with the fields of its detail page.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class ArticleDetail {

    String title;
    String link;
    String authors;
    String source;
    String pubDate;
    int citeCount;
    int downloadCount;

    String abstractText;
    String keywords;
    String doi;
    String organization;
    String crawlTime;

    /**
     * Whether detail page fields were merged in.
     */
    boolean enriched;

    public static ArticleDetail fromSearchResult(SearchResult result) {
        return ArticleDetail.builder()
            .title(result.getTitle())
            .link(result.getLink())
            .authors(result.getAuthors())
            .source(result.getSource())
            .pubDate(result.getPubDate())
            .citeCount(result.getCiteCount())
            .downloadCount(result.getDownloadCount())
            .enriched(false)
            .build();
    }

}
