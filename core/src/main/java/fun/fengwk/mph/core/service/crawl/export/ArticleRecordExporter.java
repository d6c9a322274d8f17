package fun.fengwk.mph.core.service.crawl.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fun.fengwk.mph.core.service.crawl.model.ArticleDetail;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Flattens articles into records and persists them as JSON.
 *
 * <p>Every record of one export carries the sorted union of keys across all records, absent values are null.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ArticleRecordExporter {

    public static final String TITLE = "title";
    public static final String LINK = "link";
    public static final String AUTHORS = "authors";
    public static final String SOURCE = "source";
    public static final String PUB_DATE = "pubDate";
    public static final String CITE_COUNT = "citeCount";
    public static final String DOWNLOAD_COUNT = "downloadCount";
    public static final String ABSTRACT = "abstract";
    public static final String KEYWORDS = "keywords";
    public static final String DOI = "doi";
    public static final String ORGANIZATION = "organization";
    public static final String CRAWL_TIME = "crawlTime";

    private final ObjectMapper objectMapper;

    public ArticleRecordExporter() {
        this(new ObjectMapper());
    }

    public ArticleRecordExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Flatten one article. Detail keys are present only for enriched articles.
     */
    public Map<String, Object> toRecord(ArticleDetail article) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(TITLE, article.getTitle());
        record.put(LINK, article.getLink());
        record.put(AUTHORS, article.getAuthors());
        record.put(SOURCE, article.getSource());
        record.put(PUB_DATE, article.getPubDate());
        record.put(CITE_COUNT, article.getCiteCount());
        record.put(DOWNLOAD_COUNT, article.getDownloadCount());
        if (article.isEnriched()) {
            record.put(ABSTRACT, article.getAbstractText());
            record.put(KEYWORDS, article.getKeywords());
            record.put(DOI, article.getDoi());
            record.put(ORGANIZATION, article.getOrganization());
            record.put(CRAWL_TIME, article.getCrawlTime());
        }
        return record;
    }

    /**
     * Flatten a collection, normalizing every record to the sorted union key set.
     *
     * @param fields optional projection, null or empty keeps every key
     */
    public List<Map<String, Object>> toRecords(Collection<ArticleDetail> articles, Collection<String> fields) {
        List<Map<String, Object>> raw = new ArrayList<>(articles.size());
        for (ArticleDetail article : articles) {
            raw.add(toRecord(article));
        }
        return normalize(raw, fields);
    }

    public List<Map<String, Object>> normalize(List<Map<String, Object>> records, Collection<String> fields) {
        TreeSet<String> keys = new TreeSet<>();
        if (fields != null && !fields.isEmpty()) {
            keys.addAll(fields);
        } else {
            records.forEach(record -> keys.addAll(record.keySet()));
        }

        List<Map<String, Object>> normalized = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            Map<String, Object> row = new TreeMap<>();
            for (String key : keys) {
                row.put(key, record.get(key));
            }
            normalized.add(row);
        }
        return normalized;
    }

    public void writeJson(Path path, List<Map<String, Object>> records) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), records);
        log.info("records exported, path={}, count={}", path, records.size());
    }

}
