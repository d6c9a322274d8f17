package fun.fengwk.mph.core.service.crawl;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a DOI from raw page markup.
 *
 * @author fengwk
 */
public final class DoiExtractor {

    private static final Pattern LABELED_DOI_PATTERN = Pattern.compile("DOI[：:]\\s*(10\\.\\d{4,}/[^\\s<>]+)");
    private static final Pattern BARE_DOI_PATTERN = Pattern.compile("10\\.\\d{4,}/[^\\s<>]+");

    private DoiExtractor() {
    }

    /**
     * A labelled match wins over the first bare match.
     *
     * @return the doi, or null when absent
     */
    public static String extract(String markup) {
        if (markup == null || markup.isEmpty()) {
            return null;
        }
        Matcher labeled = LABELED_DOI_PATTERN.matcher(markup);
        if (labeled.find()) {
            return labeled.group(1);
        }
        Matcher bare = BARE_DOI_PATTERN.matcher(markup);
        if (bare.find()) {
            return bare.group();
        }
        return null;
    }

}
