package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionSourceType;
import fun.fengwk.mph.core.service.acquire.support.BrowserDownloader;
import fun.fengwk.mph.core.service.acquire.support.PdfHttpFetcher;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Mirror lookup by DOI.
 *
 * @author fengwk
 */
@Component
public class DoiLookupAcquisition extends AbstractMirrorLookupSource {

    public DoiLookupAcquisition(
        AcquireProperties acquireProperties,
        PdfHttpFetcher pdfHttpFetcher,
        BrowserDownloader browserDownloader
    ) {
        super(acquireProperties, pdfHttpFetcher, browserDownloader);
    }

    @Override
    public AcquisitionSourceType type() {
        return AcquisitionSourceType.DOI_LOOKUP;
    }

    @Override
    public boolean isApplicable(AcquisitionRequest request) {
        return StringUtils.isNotBlank(request.getDoi());
    }

    @Override
    protected String lookupKey(AcquisitionRequest request) {
        return request.getDoi().trim();
    }

}
