package fun.fengwk.mph.core.service.convert;

import fun.fengwk.mph.core.service.convert.model.DocumentClassification;
import fun.fengwk.mph.core.service.convert.model.DocumentSample;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Classifies a bounded text sample of a document. Pure and deterministic.
 *
 * <ol>
 *     <li>null sample: {@link DocumentClassification#UNKNOWN}</li>
 *     <li>empty or whitespace only text: {@link DocumentClassification#SCANNED}</li>
 *     <li>readable ratio below threshold or repeat ratio above threshold: {@link DocumentClassification#GARBLED}</li>
 *     <li>otherwise {@link DocumentClassification#TEXT_LAYER}</li>
 * </ol>
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class DocumentClassifier {

    private static final String READABLE_PUNCTUATION = ".,;:!?'\"()-[]{}@#$%&*+=/<>";

    private final ConvertProperties convertProperties;

    public DocumentClassification classify(DocumentSample sample) {
        if (sample == null) {
            return DocumentClassification.UNKNOWN;
        }
        String text = sample.text();
        if (text == null || text.isBlank()) {
            return DocumentClassification.SCANNED;
        }

        int[] codePoints = text.codePoints().toArray();
        if (readableRatio(codePoints) < convertProperties.getReadableRatioThreshold()
            || repeatRatio(codePoints, convertProperties.getRepeatRunLength()) > convertProperties.getRepeatRatioThreshold()) {
            return DocumentClassification.GARBLED;
        }
        return DocumentClassification.TEXT_LAYER;
    }

    /**
     * Readable characters over non-whitespace characters.
     */
    static double readableRatio(int[] codePoints) {
        int nonWhitespace = 0;
        int readable = 0;
        for (int codePoint : codePoints) {
            if (Character.isWhitespace(codePoint)) {
                continue;
            }
            nonWhitespace++;
            if (Character.isLetterOrDigit(codePoint) || READABLE_PUNCTUATION.indexOf(codePoint) >= 0) {
                readable++;
            }
        }
        return nonWhitespace == 0 ? 0 : (double) readable / nonWhitespace;
    }

    /**
     * Positions starting a run of identical non-whitespace characters, over the total length.
     */
    static double repeatRatio(int[] codePoints, int runLength) {
        if (codePoints.length == 0 || runLength <= 1) {
            return 0;
        }
        int repeats = 0;
        for (int i = 0; i + runLength <= codePoints.length; i++) {
            int first = codePoints[i];
            if (Character.isWhitespace(first)) {
                continue;
            }
            boolean run = true;
            for (int j = 1; j < runLength; j++) {
                if (codePoints[i + j] != first) {
                    run = false;
                    break;
                }
            }
            if (run) {
                repeats++;
            }
        }
        return (double) repeats / codePoints.length;
    }

}
