package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.AcquireProperties;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionSourceType;
import fun.fengwk.mph.core.service.acquire.support.BrowserDownloader;
import fun.fengwk.mph.core.service.acquire.support.PdfHttpFetcher;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Mirror lookup by url encoded title.
 *
 * @author fengwk
 */
@Component
public class TitleLookupAcquisition extends AbstractMirrorLookupSource {

    public TitleLookupAcquisition(
        AcquireProperties acquireProperties,
        PdfHttpFetcher pdfHttpFetcher,
        BrowserDownloader browserDownloader
    ) {
        super(acquireProperties, pdfHttpFetcher, browserDownloader);
    }

    @Override
    public AcquisitionSourceType type() {
        return AcquisitionSourceType.TITLE_LOOKUP;
    }

    @Override
    public boolean isApplicable(AcquisitionRequest request) {
        return StringUtils.isNotBlank(request.getTitle());
    }

    @Override
    protected String lookupKey(AcquisitionRequest request) {
        return encodeQuery(request.getTitle());
    }

}
