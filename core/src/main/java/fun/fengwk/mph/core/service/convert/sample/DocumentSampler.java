package fun.fengwk.mph.core.service.convert.sample;

import fun.fengwk.mph.core.service.convert.ConvertProperties;
import fun.fengwk.mph.core.service.convert.model.DocumentSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Builds a classification sample from the first pages of a document.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentSampler {

    private final PdfSampler pdfSampler;
    private final ConvertProperties convertProperties;

    /**
     * @return the sample, empty when the document cannot be opened or has no pages
     */
    public Optional<DocumentSample> sample(Path document) {
        try (PdfSampler.SampledDocument sampled = pdfSampler.open(document)) {
            int pageCount = sampled.pageCount();
            if (pageCount <= 0) {
                log.warn("document has no pages, document={}", document);
                return Optional.empty();
            }
            int depth = Math.min(pageCount, Math.max(1, convertProperties.getSamplePages()));
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < depth; i++) {
                if (i > 0) {
                    text.append('\n');
                }
                text.append(sampled.extractPageText(i));
            }
            return Optional.of(new DocumentSample(text.toString(), pageCount));
        } catch (IOException | RuntimeException ex) {
            log.warn("sample document failed, document={}, error={}", document, ex.getMessage());
            return Optional.empty();
        }
    }

}
