package fun.fengwk.mph.core.service.convert;

import fun.fengwk.mph.core.service.convert.model.ConversionOutcome;
import fun.fengwk.mph.core.service.convert.model.PdfConvertRequest;

/**
 * @author fengwk
 */
public interface PdfConversionService {

    ConversionOutcome convert(PdfConvertRequest request);

}
