package fun.fengwk.mph.core.service.acquire.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Acquisition source kinds. Declaration order is the default attempt order.
 *
 * @author fengwk
 */
public enum AcquisitionSourceType {

    DIRECT_SOURCE("cnki"),
    DOI_LOOKUP("scihub"),
    TITLE_LOOKUP("scihub_title"),
    AGGREGATOR("annas_archive"),
    WEB_SEARCH("google_scholar");

    private final String value;

    AcquisitionSourceType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AcquisitionSourceType fromValue(String value) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("source is blank");
        }
        for (AcquisitionSourceType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("unsupported source: " + value);
    }

}
