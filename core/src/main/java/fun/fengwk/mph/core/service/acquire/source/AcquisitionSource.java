package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionSourceType;

/**
 * One acquisition strategy.
 *
 * @author fengwk
 */
public interface AcquisitionSource {

    AcquisitionSourceType type();

    /**
     * Whether the request carries the input this source needs. Inapplicable sources are never attempted.
     */
    boolean isApplicable(AcquisitionRequest request);

    /**
     * Try to deliver a plausible PDF to {@link AcquisitionContext#getTarget()}. Must not throw for expected misses.
     */
    SourceOutcome attempt(AcquisitionContext context);

}
