package fun.fengwk.mph.core.service.crawl.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Paper search response model.
 *
 * @author fengwk
 */
@Data
@Builder
public class PaperSearchResponse {

    private int statusCode;
    private String keyword;
    private String sortOrder;

    /**
     * Whether the session hit the block page, records are then partial.
     */
    private boolean blocked;

    private List<Map<String, Object>> records;
    private String outputPath;
    private Long elapsedMs;
    private String error;

}
