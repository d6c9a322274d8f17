package fun.fengwk.mph.core.service.convert.model;

/**
 * Text quality class of a document sample.
 *
 * @author fengwk
 */
public enum DocumentClassification {

    /**
     * Usable text layer.
     */
    TEXT_LAYER,

    /**
     * No text layer, image only pages.
     */
    SCANNED,

    /**
     * A text layer exists but decodes to noise.
     */
    GARBLED,

    /**
     * The document could not be sampled.
     */
    UNKNOWN

}
