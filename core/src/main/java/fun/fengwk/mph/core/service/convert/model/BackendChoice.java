package fun.fengwk.mph.core.service.convert.model;

/**
 * Routing decision.
 *
 * @param backendName backend to run first
 * @param degraded    the preferred backend was unavailable and quality may suffer
 * @param recheckOutput reclassify the produced text and retry with OCR when still garbled
 * @author fengwk
 */
public record BackendChoice(String backendName, boolean degraded, boolean recheckOutput) {
}
