package fun.fengwk.mph.core.service.acquire.source;

import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.browser.session.FetchSession;
import fun.fengwk.mph.core.service.browser.session.RequestPacer;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Per request state shared by the attempted sources.
 *
 * @author fengwk
 */
@Value
@Builder
public class AcquisitionContext {

    AcquisitionRequest request;
    FetchSession session;

    /**
     * Staging {@code {stem}.pdf} path, identical for every attempt of one request. The pipeline moves it into the
     * download directory only after verification.
     */
    Path target;

    /**
     * Delay applied after page navigations.
     */
    RequestPacer pagePacer;

}
