package fun.fengwk.mph.core.service.crawl.impl;

import fun.fengwk.mph.core.service.browser.session.FetchSession;
import fun.fengwk.mph.core.service.browser.session.FetchSessionFactory;
import fun.fengwk.mph.core.service.crawl.CrawlProperties;
import fun.fengwk.mph.core.service.crawl.CrawlState;
import fun.fengwk.mph.core.service.crawl.PaperSearchService;
import fun.fengwk.mph.core.service.crawl.SearchCrawler;
import fun.fengwk.mph.core.service.crawl.export.ArticleRecordExporter;
import fun.fengwk.mph.core.service.crawl.model.ArticleDetail;
import fun.fengwk.mph.core.service.crawl.model.PaperSearchRequest;
import fun.fengwk.mph.core.service.crawl.model.PaperSearchResponse;
import fun.fengwk.mph.core.service.crawl.model.SortOrder;
import fun.fengwk.mph.core.service.guard.AntiBlockDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Paper search service implementation, one fetch session per request.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaperSearchServiceImpl implements PaperSearchService {

    private static final int MAX_RESULTS_LIMIT = 200;

    private final FetchSessionFactory fetchSessionFactory;
    private final AntiBlockDetector antiBlockDetector;
    private final CrawlProperties crawlProperties;
    private final ArticleRecordExporter articleRecordExporter;

    @Override
    public PaperSearchResponse search(PaperSearchRequest request) {
        long startAt = System.currentTimeMillis();
        try {
            validateRequest(request);
            SortOrder sortOrder = SortOrder.fromValue(request.getSortOrder());
            int maxResults = request.getMaxResults() == null
                ? crawlProperties.getDefaultMaxResults() : request.getMaxResults();
            boolean getDetails = request.getGetDetails() == null || request.getGetDetails();

            List<ArticleDetail> articles;
            boolean blocked;
            try (FetchSession session = fetchSessionFactory.open()) {
                SearchCrawler crawler = new SearchCrawler(session, antiBlockDetector, crawlProperties);
                articles = crawler.searchAndCrawl(request.getKeyword(), maxResults, sortOrder, getDetails);
                blocked = crawler.getState() == CrawlState.BLOCKED;
            }

            List<Map<String, Object>> records = articleRecordExporter.toRecords(articles, request.getFields());
            String outputPath = null;
            if (StringUtils.isNotBlank(request.getOutputPath())) {
                Path path = Paths.get(request.getOutputPath().trim());
                articleRecordExporter.writeJson(path, records);
                outputPath = path.toAbsolutePath().toString();
            }

            return PaperSearchResponse.builder()
                .statusCode(200)
                .keyword(request.getKeyword())
                .sortOrder(sortOrder.getValue())
                .blocked(blocked)
                .records(records)
                .outputPath(outputPath)
                .error(blocked ? "blocked by anti-automation check, results are partial" : null)
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (IllegalArgumentException ex) {
            log.warn("paper search request invalid, keyword={}, error={}",
                request == null ? "" : request.getKeyword(), ex.getMessage());
            return PaperSearchResponse.builder()
                .statusCode(400)
                .keyword(request == null ? null : request.getKeyword())
                .records(List.of())
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (Exception ex) {
            log.warn("paper search failed, keyword={}, error={}",
                request == null ? "" : request.getKeyword(), ex.getMessage(), ex);
            return PaperSearchResponse.builder()
                .statusCode(500)
                .keyword(request == null ? null : request.getKeyword())
                .records(List.of())
                .error(ex.getMessage())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        }
    }

    private void validateRequest(PaperSearchRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        if (StringUtils.isBlank(request.getKeyword())) {
            throw new IllegalArgumentException("keyword is blank");
        }
        request.setKeyword(request.getKeyword().trim());
        Integer maxResults = request.getMaxResults();
        if (maxResults != null && (maxResults <= 0 || maxResults > MAX_RESULTS_LIMIT)) {
            throw new IllegalArgumentException("maxResults out of range");
        }
        SortOrder.fromValue(request.getSortOrder());
    }

}
