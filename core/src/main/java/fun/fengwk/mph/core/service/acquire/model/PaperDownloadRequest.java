package fun.fengwk.mph.core.service.acquire.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Download request over one or more articles.
 *
 * @author fengwk
 */
@Data
@Builder
public class PaperDownloadRequest {

    private List<AcquisitionRequest> items;

    /**
     * External source names in attempt order, empty means the default order.
     */
    private List<String> sources;

    private String downloadDir;
    private Boolean stopOnFailure;

}
