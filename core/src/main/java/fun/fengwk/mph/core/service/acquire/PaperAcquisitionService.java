package fun.fengwk.mph.core.service.acquire;

import fun.fengwk.mph.core.service.acquire.model.PaperDownloadRequest;
import fun.fengwk.mph.core.service.acquire.model.PaperDownloadResponse;

/**
 * @author fengwk
 */
public interface PaperAcquisitionService {

    PaperDownloadResponse download(PaperDownloadRequest request);

}
