package fun.fengwk.mph.core.service.crawl.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Paper search request model.
 *
 * @author fengwk
 */
@Data
@Builder
public class PaperSearchRequest {

    private String keyword;
    private Integer maxResults;
    private String sortOrder;
    private Boolean getDetails;

    /**
     * Optional field projection over the exported record keys.
     */
    private List<String> fields;

    /**
     * Optional JSON file the records are persisted to.
     */
    private String outputPath;

}
