package fun.fengwk.mph.core.service.acquire.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata of one article to acquire. At least one of title and doi is required.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcquisitionRequest {

    private String title;
    private String doi;

    /**
     * Detail page link on the originating site.
     */
    private String link;

}
