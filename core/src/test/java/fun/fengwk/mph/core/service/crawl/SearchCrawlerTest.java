package fun.fengwk.mph.core.service.crawl;

import fun.fengwk.mph.core.service.browser.session.FakeFetchSession;
import fun.fengwk.mph.core.service.browser.session.PageElement;
import fun.fengwk.mph.core.service.browser.session.RequestPacer;
import fun.fengwk.mph.core.service.browser.session.StubPageElement;
import fun.fengwk.mph.core.service.crawl.model.ArticleDetail;
import fun.fengwk.mph.core.service.crawl.model.SearchResult;
import fun.fengwk.mph.core.service.crawl.model.SortOrder;
import fun.fengwk.mph.core.service.guard.AntiBlockDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class SearchCrawlerTest {

    private static final String SEARCH_PREFIX = "https://kns.cnki.net/kns8s/search";
    private static final String DETAIL_PREFIX = "https://kns.cnki.net/kcms2/article/abstract?v=";

    private FakeFetchSession session;
    private CrawlProperties crawlProperties;
    private SearchCrawler crawler;

    @BeforeEach
    void setUp() {
        session = new FakeFetchSession();
        crawlProperties = new CrawlProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneId.of("UTC"));
        crawler = new SearchCrawler(session, new AntiBlockDetector(crawlProperties), crawlProperties,
            RequestPacer.NONE, clock);
    }

    @Test
    public void testSearchParsesRows() {
        searchPage(2);

        List<SearchResult> results = crawler.search("深度学习", 10, SortOrder.RELEVANCE);

        assertThat(results).hasSize(2);
        SearchResult first = results.get(0);
        assertThat(first.getTitle()).isEqualTo("Paper 1");
        assertThat(first.getLink()).isEqualTo(DETAIL_PREFIX + 1);
        assertThat(first.getAuthors()).isEqualTo("Author 1");
        assertThat(first.getSource()).isEqualTo("Journal 1");
        assertThat(first.getPubDate()).isEqualTo("2023-01-01");
        assertThat(first.getCiteCount()).isEqualTo(11);
        assertThat(first.getDownloadCount()).isEqualTo(101);
        assertThat(crawler.getState()).isEqualTo(CrawlState.RESULTS_PARSED);
        assertThat(session.getNavigations().get(0)).startsWith(SEARCH_PREFIX + "?classid=WD0FTY92&kw=");
    }

    @Test
    public void testMaxResultsCapsParsedRows() {
        searchPage(8);

        List<SearchResult> results = crawler.search("machine learning", 5, null);

        assertThat(results).hasSize(5);
        assertThat(results).extracting(SearchResult::getTitle)
            .containsExactly("Paper 1", "Paper 2", "Paper 3", "Paper 4", "Paper 5");
    }

    @Test
    public void testInvalidArgumentsAreRejected() {
        assertThatThrownBy(() -> crawler.search(" ", 5, SortOrder.DATE))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crawler.search("graph", 0, SortOrder.DATE))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(session.getNavigations()).isEmpty();
    }

    @Test
    public void testSortControlIsClicked() {
        StubPageElement dateControl = StubPageElement.of("发表时间");
        searchPage(1).element("#orderList li#PT", dateControl);

        crawler.search("graph", 5, SortOrder.DATE);

        assertThat(dateControl.getClickCount()).isEqualTo(1);
        assertThat(session.getPauses()).containsExactly(crawlProperties.getSortSettleMs());
    }

    @Test
    public void testBlockedSearchReturnsNothing() {
        searchPage(3).element("#verify-bar-box", StubPageElement.of(""));

        List<SearchResult> results = crawler.search("graph", 5, SortOrder.RELEVANCE);

        assertThat(results).isEmpty();
        assertThat(crawler.getState()).isEqualTo(CrawlState.BLOCKED);
    }

    @Test
    public void testGetDetailExtractsFields() {
        detailPage(1, "Paper 1 detail");

        Optional<ArticleDetail> detail = crawler.getDetail("/kcms2/article/abstract?v=1");

        assertThat(detail).isPresent();
        assertThat(detail.get().getTitle()).isEqualTo("Paper 1 detail");
        assertThat(detail.get().getAbstractText()).isEqualTo("Abstract 1");
        assertThat(detail.get().getKeywords()).isEqualTo("k1;k2");
        assertThat(detail.get().getOrganization()).isEqualTo("Org 1");
        assertThat(detail.get().getDoi()).isEqualTo("10.1000/demo.1");
        assertThat(detail.get().getCrawlTime()).isEqualTo("2024-05-01 08:00:00");
        assertThat(session.getNavigations()).containsExactly(DETAIL_PREFIX + 1);
    }

    @Test
    public void testBlockedGetDetailDoesNotNavigate() {
        detailPage(1, "Paper 1 detail");
        session.blockState().markBlocked("captcha");

        Optional<ArticleDetail> detail = crawler.getDetail(DETAIL_PREFIX + 1);

        assertThat(detail).isEmpty();
        assertThat(session.getNavigations()).isEmpty();
    }

    @Test
    public void testSearchAndCrawlWithoutDetails() {
        searchPage(3);

        List<ArticleDetail> articles = crawler.searchAndCrawl("graph", 3, SortOrder.RELEVANCE, false);

        assertThat(articles).hasSize(3);
        assertThat(articles).noneMatch(ArticleDetail::isEnriched);
        assertThat(session.getNavigations()).hasSize(1);
        assertThat(crawler.getState()).isEqualTo(CrawlState.DONE);
    }

    @Test
    public void testSearchAndCrawlKeepsListCounters() {
        searchPage(2);
        detailPage(1, "Paper 1 detail");
        detailPage(2, "Paper 2 detail");

        List<ArticleDetail> articles = crawler.searchAndCrawl("graph", 2, SortOrder.RELEVANCE, true);

        assertThat(articles).hasSize(2);
        assertThat(articles).allMatch(ArticleDetail::isEnriched);
        assertThat(articles.get(0).getTitle()).isEqualTo("Paper 1 detail");
        assertThat(articles.get(0).getCiteCount()).isEqualTo(11);
        assertThat(articles.get(0).getDownloadCount()).isEqualTo(101);
        assertThat(articles.get(1).getCiteCount()).isEqualTo(12);
        assertThat(crawler.getState()).isEqualTo(CrawlState.DONE);
    }

    @Test
    public void testBlockMidwayKeepsRemainingResultsUnenriched() {
        searchPage(7);
        for (int i = 1; i <= 7; i++) {
            detailPage(i, "Paper " + i + " detail");
        }
        session.page(DETAIL_PREFIX + 4, "Paper 4", "<html></html>")
            .element("#verify-bar-box", StubPageElement.of(""));

        List<ArticleDetail> articles = crawler.searchAndCrawl("graph", 7, SortOrder.RELEVANCE, true);

        assertThat(articles).hasSize(7);
        assertThat(articles.subList(0, 3)).allMatch(ArticleDetail::isEnriched);
        assertThat(articles.subList(3, 7)).noneMatch(ArticleDetail::isEnriched);
        assertThat(articles).extracting(ArticleDetail::getLink)
            .containsExactly(DETAIL_PREFIX + 1, DETAIL_PREFIX + 2, DETAIL_PREFIX + 3, DETAIL_PREFIX + 4,
                DETAIL_PREFIX + 5, DETAIL_PREFIX + 6, DETAIL_PREFIX + 7);
        assertThat(session.getNavigations()).doesNotContain(DETAIL_PREFIX + 5);
        assertThat(crawler.getState()).isEqualTo(CrawlState.BLOCKED);
    }

    private FakeFetchSession.FakePage searchPage(int rows) {
        FakeFetchSession.FakePage page = session.page(SEARCH_PREFIX, "检索-中国知网", "<html></html>");
        for (int i = 1; i <= rows; i++) {
            page.element(".result-table-list tbody tr", row(i));
        }
        return page;
    }

    private PageElement row(int i) {
        StubPageElement row = StubPageElement.of("")
            .child(".name a", StubPageElement.of("Paper " + i).attr("href", DETAIL_PREFIX + i))
            .child(".author", StubPageElement.of("Author " + i))
            .child(".source", StubPageElement.of("Journal " + i))
            .child(".date", StubPageElement.of("2023-01-0" + i));
        for (int cell = 0; cell < 8; cell++) {
            String text = cell == 6 ? String.valueOf(10 + i) : cell == 7 ? String.valueOf(100 + i) : "";
            row.child("td", StubPageElement.of(text));
        }
        return row;
    }

    private void detailPage(int i, String title) {
        session.page(DETAIL_PREFIX + i, title, "<html><p>DOI：10.1000/demo." + i + "</p></html>")
            .element(".wx-tit h1", StubPageElement.of(title))
            .element(".abstract-text", StubPageElement.of("Abstract " + i))
            .element(".keywords", StubPageElement.of("k1;k2"))
            .element(".orgn", StubPageElement.of("Org " + i));
    }

}
