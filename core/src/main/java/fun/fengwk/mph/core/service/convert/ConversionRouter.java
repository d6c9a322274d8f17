package fun.fengwk.mph.core.service.convert;

import fun.fengwk.mph.core.service.convert.backend.ConversionBackend;
import fun.fengwk.mph.core.service.convert.backend.ConversionBackendRegistry;
import fun.fengwk.mph.core.service.convert.model.BackendChoice;
import fun.fengwk.mph.core.service.convert.model.ConversionOutcome;
import fun.fengwk.mph.core.service.convert.model.ConversionTarget;
import fun.fengwk.mph.core.service.convert.model.DocumentClassification;
import fun.fengwk.mph.core.service.convert.model.DocumentSample;
import fun.fengwk.mph.core.service.convert.sample.DocumentSampler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Classifies a document and routes it to an extraction backend.
 *
 * <table>
 *     <tr><th>classification</th><th>backend</th></tr>
 *     <tr><td>TEXT_LAYER</td><td>lightweight</td></tr>
 *     <tr><td>SCANNED</td><td>OCR with a credential, else lightweight flagged degraded</td></tr>
 *     <tr><td>GARBLED</td><td>lightweight, re-run with OCR when its output is still garbled</td></tr>
 *     <tr><td>UNKNOWN</td><td>lightweight best effort</td></tr>
 * </table>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionRouter {

    private final DocumentClassifier documentClassifier;
    private final DocumentSampler documentSampler;
    private final ConversionBackendRegistry backendRegistry;
    private final ConvertProperties convertProperties;

    public BackendChoice route(DocumentClassification classification, boolean credentialAvailable) {
        String lightweight = convertProperties.getLightweightBackend();
        switch (classification) {
            case SCANNED:
                return credentialAvailable
                    ? new BackendChoice(convertProperties.getOcrBackend(), false, false)
                    : new BackendChoice(lightweight, true, false);
            case GARBLED:
                return new BackendChoice(lightweight, false, true);
            case TEXT_LAYER:
            case UNKNOWN:
            default:
                return new BackendChoice(lightweight, false, false);
        }
    }

    public ConversionOutcome convert(Path document, ConversionTarget target) {
        DocumentClassification classification = documentSampler.sample(document)
            .map(documentClassifier::classify)
            .orElse(DocumentClassification.UNKNOWN);
        boolean credentialAvailable = convertProperties.hasOcrCredential();
        BackendChoice choice = route(classification, credentialAvailable);
        log.info("conversion routed, document={}, classification={}, backend={}, degraded={}",
            document, classification, choice.backendName(), choice.degraded());

        Optional<ConversionBackend> backend = resolve(choice.backendName());
        if (backend.isEmpty()) {
            return ConversionOutcome.builder()
                .success(false)
                .classification(classification)
                .message("configuration missing: no conversion backend registered for "
                    + choice.backendName() + " or " + convertProperties.getLightweightBackend())
                .build();
        }

        ConversionOutcome outcome = backend.get().convert(document, target);
        if (!outcome.isSuccess() && !backend.get().name().equals(convertProperties.getLightweightBackend())) {
            Optional<ConversionBackend> lightweight = backendRegistry.find(convertProperties.getLightweightBackend());
            if (lightweight.isPresent()) {
                log.warn("conversion failed, fallback to lightweight, backend={}, error={}",
                    backend.get().name(), outcome.getMessage());
                String failure = outcome.getMessage();
                outcome = lightweight.get().convert(document, target);
                if (outcome.isSuccess()) {
                    outcome.setMessage(outcome.getMessage() + " (degraded: " + failure + ")");
                }
            }
        }
        if (!backend.get().name().equals(choice.backendName()) && outcome.isSuccess()) {
            outcome.setMessage(outcome.getMessage() + " (degraded: " + choice.backendName() + " not registered)");
        }
        if (choice.degraded() && outcome.isSuccess()) {
            outcome.setMessage(outcome.getMessage() + " (degraded: scanned document converted without ocr)");
        }
        if (choice.recheckOutput() && outcome.isSuccess()) {
            outcome = recheckGarbledOutput(document, target, outcome, credentialAvailable);
        }
        outcome.setClassification(classification);
        return outcome;
    }

    private ConversionOutcome recheckGarbledOutput(
        Path document,
        ConversionTarget target,
        ConversionOutcome lightweightOutcome,
        boolean credentialAvailable
    ) {
        DocumentClassification outputClassification = classifyOutput(lightweightOutcome.getMarkdownPath());
        if (outputClassification != DocumentClassification.GARBLED) {
            return lightweightOutcome;
        }
        if (!credentialAvailable) {
            lightweightOutcome.setMessage(lightweightOutcome.getMessage() + " (output still garbled, no ocr credential)");
            return lightweightOutcome;
        }
        Optional<ConversionBackend> ocr = backendRegistry.find(convertProperties.getOcrBackend());
        if (ocr.isEmpty()) {
            log.warn("ocr backend not registered, keep garbled output, backend={}", convertProperties.getOcrBackend());
            return lightweightOutcome;
        }

        log.info("lightweight output still garbled, retry with ocr, document={}", document);
        ConversionOutcome ocrOutcome = ocr.get().convert(document, target);
        if (ocrOutcome.isSuccess()) {
            return ocrOutcome;
        }
        lightweightOutcome.setMessage(lightweightOutcome.getMessage() + " (ocr retry failed: " + ocrOutcome.getMessage() + ")");
        return lightweightOutcome;
    }

    private DocumentClassification classifyOutput(String markdownPath) {
        if (markdownPath == null) {
            return DocumentClassification.UNKNOWN;
        }
        try {
            String text = Files.readString(Paths.get(markdownPath), StandardCharsets.UTF_8);
            return documentClassifier.classify(DocumentSample.ofText(text));
        } catch (IOException ex) {
            log.warn("read converted output failed, path={}, error={}", markdownPath, ex.getMessage());
            return DocumentClassification.UNKNOWN;
        }
    }

    private Optional<ConversionBackend> resolve(String name) {
        Optional<ConversionBackend> backend = backendRegistry.find(name);
        if (backend.isPresent()) {
            return backend;
        }
        log.warn("conversion backend not registered, fallback to lightweight, backend={}", name);
        return backendRegistry.find(convertProperties.getLightweightBackend());
    }

}
