package fun.fengwk.mph.core.service.convert.sample;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens documents for page level text sampling.
 *
 * @author fengwk
 */
public interface PdfSampler {

    SampledDocument open(Path document) throws IOException;

    /**
     * An opened document.
     */
    interface SampledDocument extends Closeable {

        int pageCount();

        /**
         * Text layer of one zero based page.
         */
        String extractPageText(int pageIndex) throws IOException;

    }

}
