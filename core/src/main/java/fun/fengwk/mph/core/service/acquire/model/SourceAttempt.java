package fun.fengwk.mph.core.service.acquire.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome record of one source in the attempt list.
 *
 * @author fengwk
 */
@Value
@Builder
public class SourceAttempt {

    AcquisitionSourceType source;
    boolean success;

    /**
     * Null on success.
     */
    AcquisitionFailure failure;

    String message;

}
