package fun.fengwk.mph.core.service.convert.sample;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * PDFBox backed sampler.
 *
 * @author fengwk
 */
@Component
public class PdfBoxSampler implements PdfSampler {

    @Override
    public SampledDocument open(Path document) throws IOException {
        return wrap(PDDocument.load(document.toFile()));
    }

    /**
     * Takes ownership of the loaded document, it is closed when wrapping fails.
     */
    SampledDocument wrap(PDDocument pdDocument) throws IOException {
        try {
            return new PdfBoxSampledDocument(pdDocument, newStripper());
        } catch (IOException | RuntimeException ex) {
            pdDocument.close();
            throw ex;
        }
    }

    PDFTextStripper newStripper() throws IOException {
        return new PDFTextStripper();
    }

    private static class PdfBoxSampledDocument implements SampledDocument {

        private final PDDocument document;
        private final PDFTextStripper stripper;

        PdfBoxSampledDocument(PDDocument document, PDFTextStripper stripper) {
            this.document = document;
            this.stripper = stripper;
        }

        @Override
        public int pageCount() {
            return document.getNumberOfPages();
        }

        @Override
        public String extractPageText(int pageIndex) throws IOException {
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            return stripper.getText(document);
        }

        @Override
        public void close() throws IOException {
            document.close();
        }

    }

}
