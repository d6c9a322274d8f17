package fun.fengwk.mph.core.service.crawl;

import fun.fengwk.mph.core.service.crawl.model.ArticleDetail;
import fun.fengwk.mph.core.service.crawl.model.SearchResult;
import org.apache.commons.lang3.StringUtils;

/**
 * Merges a list row with its detail page.
 *
 * <p>Counters keep the list value when it is non-zero. Every other field takes the detail value when it is
 * non-blank, otherwise the list value.
 *
 * @author fengwk
 */
public final class ArticleMerger {

    private ArticleMerger() {
    }

    public static ArticleDetail merge(SearchResult result, ArticleDetail detail) {
        if (detail == null) {
            return ArticleDetail.fromSearchResult(result);
        }
        return ArticleDetail.builder()
            .title(prefer(detail.getTitle(), result.getTitle()))
            .link(prefer(detail.getLink(), result.getLink()))
            .authors(prefer(detail.getAuthors(), result.getAuthors()))
            .source(prefer(detail.getSource(), result.getSource()))
            .pubDate(prefer(detail.getPubDate(), result.getPubDate()))
            .citeCount(result.getCiteCount() != 0 ? result.getCiteCount() : detail.getCiteCount())
            .downloadCount(result.getDownloadCount() != 0 ? result.getDownloadCount() : detail.getDownloadCount())
            .abstractText(detail.getAbstractText())
            .keywords(detail.getKeywords())
            .doi(detail.getDoi())
            .organization(detail.getOrganization())
            .crawlTime(detail.getCrawlTime())
            .enriched(true)
            .build();
    }

    private static String prefer(String detailValue, String listValue) {
        return StringUtils.isNotBlank(detailValue) ? detailValue : listValue;
    }

}
