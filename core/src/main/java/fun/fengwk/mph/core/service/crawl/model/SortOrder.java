package fun.fengwk.mph.core.service.crawl.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Result ordering of a search, mapped to the sort control id of the result page.
 *
 * @author fengwk
 */
public enum SortOrder {

    RELEVANCE("relevance", null),
    DATE("date", "PT"),
    CITED_COUNT("citedCount", "CF"),
    DOWNLOAD_COUNT("downloadCount", "DFR");

    private final String value;
    private final String sortId;

    SortOrder(String value, String sortId) {
        this.value = value;
        this.sortId = sortId;
    }

    public String getValue() {
        return value;
    }

    /**
     * Sort control id, null means the page's default ordering.
     */
    public String getSortId() {
        return sortId;
    }

    public static SortOrder fromValue(String value) {
        if (StringUtils.isBlank(value)) {
            return RELEVANCE;
        }
        String normalized = value.trim();
        if ("cited".equalsIgnoreCase(normalized)) {
            return CITED_COUNT;
        }
        if ("download".equalsIgnoreCase(normalized)) {
            return DOWNLOAD_COUNT;
        }
        for (SortOrder order : values()) {
            if (order.value.equalsIgnoreCase(normalized)) {
                return order;
            }
        }
        throw new IllegalArgumentException("unsupported sort order: " + value);
    }

}
