package fun.fengwk.mph.core.service.acquire.support;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * PDF payload detection helpers.
 *
 * @author fengwk
 */
@Slf4j
public final class PdfPayloads {

    private static final byte[] PDF_SIGNATURE = {'%', 'P', 'D', 'F'};

    private PdfPayloads() {
    }

    public static String resolveMime(Map<String, String> headers) {
        String contentType = findHeader(headers, "content-type");
        if (StringUtils.isBlank(contentType)) {
            return "application/octet-stream";
        }

        String normalized = contentType.trim().toLowerCase(Locale.ROOT);
        int semicolonIndex = normalized.indexOf(';');
        if (semicolonIndex >= 0) {
            normalized = normalized.substring(0, semicolonIndex).trim();
        }
        return StringUtils.isBlank(normalized) ? "application/octet-stream" : normalized;
    }

    public static String findHeader(Map<String, String> headers, String name) {
        if (headers == null || headers.isEmpty() || StringUtils.isBlank(name)) {
            return "";
        }

        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey())) {
                return entry.getValue() == null ? "" : entry.getValue();
            }
        }
        return "";
    }

    public static boolean hasPdfSignature(byte[] head) {
        if (head == null || head.length < PDF_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < PDF_SIGNATURE.length; i++) {
            if (head[i] != PDF_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    public static boolean hasPdfSignature(Path file) {
        try (InputStream input = Files.newInputStream(file)) {
            return hasPdfSignature(input.readNBytes(PDF_SIGNATURE.length));
        } catch (IOException ex) {
            log.debug("read pdf signature failed, file={}, error={}", file, ex.getMessage());
            return false;
        }
    }

    /**
     * A payload is plausible when it reaches the size threshold and either declares or carries a PDF.
     */
    public static boolean isPlausiblePdf(Path file, String mime, long minBytes) {
        long size = sizeOf(file);
        if (size < minBytes) {
            return false;
        }
        return (mime != null && mime.toLowerCase(Locale.ROOT).contains("pdf")) || hasPdfSignature(file);
    }

    /**
     * Final check of a delivered file: exists, non-empty and signed.
     */
    public static boolean isVerifiedPdf(Path file) {
        return file != null && Files.isRegularFile(file) && sizeOf(file) > 0 && hasPdfSignature(file);
    }

    public static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            return -1;
        }
    }

}
