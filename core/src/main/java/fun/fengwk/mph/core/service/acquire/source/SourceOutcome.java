package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.model.AcquisitionFailure;

import java.nio.file.Path;

/**
 * Result of one source attempt.
 *
 * @author fengwk
 */
public record SourceOutcome(boolean success, Path file, AcquisitionFailure failure, String message) {

    public static SourceOutcome success(Path file, String message) {
        return new SourceOutcome(true, file, null, message);
    }

    public static SourceOutcome miss(AcquisitionFailure failure, String message) {
        return new SourceOutcome(false, null, failure, message);
    }

}
