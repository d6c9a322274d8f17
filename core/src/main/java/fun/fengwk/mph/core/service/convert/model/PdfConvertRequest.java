package fun.fengwk.mph.core.service.convert.model;

import lombok.Builder;
import lombok.Data;

/**
 * PDF conversion request model.
 *
 * @author fengwk
 */
@Data
@Builder
public class PdfConvertRequest {

    private String pdfPath;

    /**
     * Optional output directory, defaults to the configured one or the document's directory.
     */
    private String outputDir;

    /**
     * Optional output name, defaults to the document's file name stem.
     */
    private String outputName;

}
