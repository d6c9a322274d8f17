package fun.fengwk.mph.core.service.convert.model;

import lombok.Builder;
import lombok.Data;

/**
 * Conversion outcome.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
public class ConversionOutcome {

    private boolean success;
    private String markdownPath;
    private int imageCount;
    private int pageCount;
    private String backendUsed;
    private DocumentClassification classification;
    private String message;

}
