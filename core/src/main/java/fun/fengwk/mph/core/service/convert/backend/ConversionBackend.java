package fun.fengwk.mph.core.service.convert.backend;

import fun.fengwk.mph.core.service.convert.model.ConversionOutcome;
import fun.fengwk.mph.core.service.convert.model.ConversionTarget;

import java.nio.file.Path;

/**
 * One extraction backend. Failures are reported in the outcome, never thrown.
 *
 * @author fengwk
 */
public interface ConversionBackend {

    /**
     * Registry name.
     */
    String name();

    ConversionOutcome convert(Path document, ConversionTarget target);

}
