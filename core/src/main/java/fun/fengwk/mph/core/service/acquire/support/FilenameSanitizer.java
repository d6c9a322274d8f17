package fun.fengwk.mph.core.service.acquire.support;

import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Derives file system safe file name stems.
 *
 * @author fengwk
 */
public final class FilenameSanitizer {

    private static final Pattern ILLEGAL_CHARS_PATTERN = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private FilenameSanitizer() {
    }

    /**
     * Replace illegal characters with {@code _}, collapse whitespace, trim and truncate.
     */
    public static String sanitize(String name, int maxLength) {
        if (name == null) {
            return "";
        }
        String sanitized = ILLEGAL_CHARS_PATTERN.matcher(name).replaceAll("_");
        sanitized = WHITESPACE_PATTERN.matcher(sanitized).replaceAll(" ").trim();
        if (maxLength > 0 && sanitized.length() > maxLength) {
            sanitized = sanitized.substring(0, maxLength).trim();
        }
        return sanitized;
    }

    /**
     * Stem from the title, else the doi, else a timestamp.
     */
    public static String deriveStem(AcquisitionRequest request, int maxLength, Clock clock) {
        String stem = "";
        if (StringUtils.isNotBlank(request.getTitle())) {
            stem = sanitize(request.getTitle(), maxLength);
        }
        if (stem.isEmpty() && StringUtils.isNotBlank(request.getDoi())) {
            stem = sanitize(request.getDoi().trim().replace("/", "_"), maxLength);
        }
        if (stem.isEmpty()) {
            stem = "paper_" + LocalDateTime.now(clock).format(TIMESTAMP_FORMATTER);
        }
        return stem;
    }

}
