package fun.fengwk.mph.core.service.acquire.model;

/**
 * Failure kinds of one source attempt. Every kind moves the pipeline on to the next mirror or source.
 *
 * @author fengwk
 */
public enum AcquisitionFailure {

    TRANSIENT_NETWORK,
    BLOCKED,
    NOT_FOUND,
    VALIDATION,
    TIMEOUT

}
