package fun.fengwk.mph.core.service.crawl;

import fun.fengwk.mph.core.service.crawl.model.PaperSearchRequest;
import fun.fengwk.mph.core.service.crawl.model.PaperSearchResponse;

/**
 * @author fengwk
 */
public interface PaperSearchService {

    PaperSearchResponse search(PaperSearchRequest request);

}
