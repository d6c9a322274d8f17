package fun.fengwk.mph.core.service.convert.model;

/**
 * Text of the first sampled pages and the total page count.
 *
 * @author fengwk
 */
public record DocumentSample(String text, int pageCount) {

    public static DocumentSample ofText(String text) {
        return new DocumentSample(text, 0);
    }

}
