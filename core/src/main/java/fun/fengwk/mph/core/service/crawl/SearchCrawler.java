package fun.fengwk.mph.core.service.crawl;

import fun.fengwk.mph.core.service.browser.session.FetchSession;
import fun.fengwk.mph.core.service.browser.session.PageElement;
import fun.fengwk.mph.core.service.browser.session.RequestPacer;
import fun.fengwk.mph.core.service.crawl.model.ArticleDetail;
import fun.fengwk.mph.core.service.crawl.model.SearchResult;
import fun.fengwk.mph.core.service.crawl.model.SortOrder;
import fun.fengwk.mph.core.service.guard.AntiBlockDetector;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one fetch session through search, result enumeration and per item detail fetches.
 *
 * <p>State machine: {@code IDLE -> SEARCHING -> (BLOCKED | RESULTS_PARSED) -> DETAIL_FETCHING -> DONE}.
 * The session's sticky block state is checked at every operation boundary, once it is set the crawler returns
 * what it has instead of issuing further navigations. Not thread safe, one crawler per session.
 *
 * @author fengwk
 */
@Slf4j
public class SearchCrawler {

    private static final DateTimeFormatter CRAWL_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final FetchSession session;
    private final AntiBlockDetector antiBlockDetector;
    private final CrawlProperties crawlProperties;
    private final RequestPacer pacer;
    private final Clock clock;
    private CrawlState state = CrawlState.IDLE;

    public SearchCrawler(FetchSession session, AntiBlockDetector antiBlockDetector, CrawlProperties crawlProperties) {
        this(session, antiBlockDetector, crawlProperties,
            new RequestPacer(crawlProperties.getRequestDelayMs(), crawlProperties.getRequestJitterMs()),
            Clock.systemDefaultZone());
    }

    public SearchCrawler(
        FetchSession session,
        AntiBlockDetector antiBlockDetector,
        CrawlProperties crawlProperties,
        RequestPacer pacer,
        Clock clock
    ) {
        this.session = session;
        this.antiBlockDetector = antiBlockDetector;
        this.crawlProperties = crawlProperties;
        this.pacer = pacer;
        this.clock = clock;
    }

    public CrawlState getState() {
        return state;
    }

    /**
     * Search and parse at most {@code maxResults} result rows.
     *
     * @return parsed rows, empty when blocked or when the search page could not be loaded
     */
    public List<SearchResult> search(String keyword, int maxResults, SortOrder sortOrder) {
        if (StringUtils.isBlank(keyword)) {
            throw new IllegalArgumentException("keyword is blank");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        if (session.blockState().isBlocked()) {
            state = CrawlState.BLOCKED;
            return List.of();
        }

        state = CrawlState.SEARCHING;
        String url = buildSearchUrl(keyword);
        log.info("search start, keyword={}, maxResults={}, sortOrder={}", keyword, maxResults, sortOrder);
        if (!session.navigate(url)) {
            state = CrawlState.DONE;
            return List.of();
        }
        pacer.pace(session);

        if (antiBlockDetector.check(session)) {
            state = CrawlState.BLOCKED;
            return List.of();
        }

        applySortOrder(sortOrder == null ? SortOrder.RELEVANCE : sortOrder);

        List<SearchResult> results = new ArrayList<>();
        List<PageElement> rows = findRows();
        for (PageElement row : rows) {
            if (results.size() >= maxResults) {
                break;
            }
            try {
                SearchResult result = parseRow(row);
                if (result != null) {
                    results.add(result);
                }
            } catch (RuntimeException ex) {
                log.debug("skip result row, keyword={}, error={}", keyword, ex.getMessage());
            }
        }

        state = CrawlState.RESULTS_PARSED;
        log.info("search finished, keyword={}, rows={}, results={}", keyword, rows.size(), results.size());
        return results;
    }

    /**
     * Fetch the detail page fields of one article.
     *
     * @return detail fields, empty when blocked or when navigation failed
     */
    public Optional<ArticleDetail> getDetail(String link) {
        if (StringUtils.isBlank(link) || session.blockState().isBlocked()) {
            return Optional.empty();
        }
        String url = LinkNormalizer.normalize(link, crawlProperties.getHost());
        if (!session.navigate(url)) {
            return Optional.empty();
        }
        pacer.pace(session);
        if (antiBlockDetector.check(session)) {
            return Optional.empty();
        }

        ArticleDetail detail = ArticleDetail.builder()
            .link(url)
            .title(firstText(crawlProperties.getDetailTitleSelectors()))
            .authors(firstText(crawlProperties.getDetailAuthorSelectors()))
            .organization(firstText(crawlProperties.getDetailOrganizationSelectors()))
            .abstractText(firstText(crawlProperties.getDetailAbstractSelectors()))
            .keywords(firstText(crawlProperties.getDetailKeywordSelectors()))
            .doi(DoiExtractor.extract(session.content()))
            .crawlTime(LocalDateTime.now(clock).format(CRAWL_TIME_FORMATTER))
            .enriched(true)
            .build();
        return Optional.of(detail);
    }

    /**
     * Search, then optionally enrich every result with its detail page.
     *
     * <p>When the session becomes blocked mid-way the remaining results are appended unenriched.
     */
    public List<ArticleDetail> searchAndCrawl(String keyword, int maxResults, SortOrder sortOrder, boolean getDetails) {
        List<SearchResult> results = search(keyword, maxResults, sortOrder);
        if (state == CrawlState.BLOCKED) {
            return List.of();
        }

        List<ArticleDetail> articles = new ArrayList<>(results.size());
        if (!getDetails) {
            results.forEach(result -> articles.add(ArticleDetail.fromSearchResult(result)));
            state = CrawlState.DONE;
            return articles;
        }

        state = CrawlState.DETAIL_FETCHING;
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            if (session.blockState().isBlocked()) {
                log.warn("session blocked during detail fetch, keyword={}, enriched={}, total={}",
                    keyword, i, results.size());
                for (int j = i; j < results.size(); j++) {
                    articles.add(ArticleDetail.fromSearchResult(results.get(j)));
                }
                state = CrawlState.BLOCKED;
                return articles;
            }

            if (StringUtils.isBlank(result.getLink())) {
                articles.add(ArticleDetail.fromSearchResult(result));
                continue;
            }

            Optional<ArticleDetail> detail;
            try {
                detail = getDetail(result.getLink());
            } catch (RuntimeException ex) {
                log.warn("detail fetch failed, link={}, error={}", result.getLink(), ex.getMessage());
                detail = Optional.empty();
            }
            articles.add(detail.map(d -> ArticleMerger.merge(result, d))
                .orElseGet(() -> ArticleDetail.fromSearchResult(result)));

            if (i < results.size() - 1) {
                pacer.pace(session);
            }
        }

        state = session.blockState().isBlocked() ? CrawlState.BLOCKED : CrawlState.DONE;
        return articles;
    }

    String buildSearchUrl(String keyword) {
        return crawlProperties.getSearchUrl()
            + "?classid=" + crawlProperties.getClassId()
            + "&kw=" + URLEncoder.encode(keyword.trim(), StandardCharsets.UTF_8);
    }

    private void applySortOrder(SortOrder sortOrder) {
        String sortId = sortOrder.getSortId();
        if (sortId == null) {
            return;
        }
        for (String template : crawlProperties.getSortSelectors()) {
            String selector = String.format(template, sortId);
            Optional<PageElement> control = session.findElement(selector, crawlProperties.getElementTimeoutMs());
            if (control.isPresent() && control.get().click()) {
                session.pause(crawlProperties.getSortSettleMs());
                return;
            }
        }
        log.warn("sort control not found, keep default ordering, sortOrder={}", sortOrder.getValue());
    }

    private List<PageElement> findRows() {
        for (String selector : crawlProperties.getRowSelectors()) {
            List<PageElement> rows = session.findElements(selector, crawlProperties.getRowWaitTimeoutMs());
            if (!rows.isEmpty()) {
                return rows;
            }
        }
        log.warn("no result rows found, url={}", session.currentUrl());
        return List.of();
    }

    private SearchResult parseRow(PageElement row) {
        Optional<PageElement> titleElement = firstChild(row, crawlProperties.getRowTitleSelectors());
        if (titleElement.isEmpty()) {
            return null;
        }
        String title = titleElement.get().text();
        if (StringUtils.isBlank(title)) {
            return null;
        }

        List<PageElement> cells = row.findElements("td");
        return SearchResult.builder()
            .title(title)
            .link(titleElement.get().attribute("href"))
            .authors(childText(row, crawlProperties.getRowAuthorSelectors()))
            .source(childText(row, crawlProperties.getRowSourceSelectors()))
            .pubDate(childText(row, crawlProperties.getRowDateSelectors()))
            .citeCount(parseCounter(cells, crawlProperties.getCiteCountCellIndex()))
            .downloadCount(parseCounter(cells, crawlProperties.getDownloadCountCellIndex()))
            .build();
    }

    private Optional<PageElement> firstChild(PageElement row, List<String> selectors) {
        for (String selector : selectors) {
            Optional<PageElement> element = row.findElement(selector);
            if (element.isPresent()) {
                return element;
            }
        }
        return Optional.empty();
    }

    private String childText(PageElement row, List<String> selectors) {
        return firstChild(row, selectors).map(PageElement::text).orElse("");
    }

    private int parseCounter(List<PageElement> cells, int index) {
        if (index < 0 || index >= cells.size()) {
            return 0;
        }
        String text = cells.get(index).text().trim();
        if (text.isEmpty() || !StringUtils.isNumeric(text)) {
            return 0;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private String firstText(List<String> selectors) {
        for (String selector : selectors) {
            Optional<PageElement> element = session.findElement(selector, crawlProperties.getElementTimeoutMs());
            if (element.isPresent()) {
                String text = element.get().text();
                if (StringUtils.isNotBlank(text)) {
                    return text;
                }
            }
        }
        return "";
    }

}
