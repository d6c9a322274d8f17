package fun.fengwk.mph.core.service.acquire.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Download response model.
 *
 * @author fengwk
 */
@Data
@Builder
public class PaperDownloadResponse {

    private int statusCode;
    private String downloadDir;
    private List<AcquisitionResult> results;
    private int successCount;
    private Long elapsedMs;
    private String error;

}
