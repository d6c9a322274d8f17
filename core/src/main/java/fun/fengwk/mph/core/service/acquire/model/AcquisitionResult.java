package fun.fengwk.mph.core.service.acquire.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Acquisition outcome. A successful result always points at an existing, non-empty, PDF signed file.
 *
 * @author fengwk
 */
@Data
@Builder
public class AcquisitionResult {

    private boolean success;
    private AcquisitionSourceType sourceUsed;
    private String filepath;
    private String message;
    private String title;
    private String doi;

    /**
     * Attempted sources in attempt order.
     */
    private List<SourceAttempt> attempts;

}
