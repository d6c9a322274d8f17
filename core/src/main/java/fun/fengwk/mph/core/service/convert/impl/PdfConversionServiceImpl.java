package fun.fengwk.mph.core.service.convert.impl;

import fun.fengwk.mph.core.service.acquire.support.FilenameSanitizer;
import fun.fengwk.mph.core.service.convert.ConversionRouter;
import fun.fengwk.mph.core.service.convert.ConvertProperties;
import fun.fengwk.mph.core.service.convert.PdfConversionService;
import fun.fengwk.mph.core.service.convert.model.ConversionOutcome;
import fun.fengwk.mph.core.service.convert.model.ConversionTarget;
import fun.fengwk.mph.core.service.convert.model.PdfConvertRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * PDF conversion service implementation.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfConversionServiceImpl implements PdfConversionService {

    private static final int MAX_OUTPUT_NAME_LENGTH = 100;

    private final ConversionRouter conversionRouter;
    private final ConvertProperties convertProperties;

    @Override
    public ConversionOutcome convert(PdfConvertRequest request) {
        try {
            Path document = validateRequest(request);
            ConversionTarget target = resolveTarget(request, document);
            Files.createDirectories(target.outputDir());
            return conversionRouter.convert(document, target);
        } catch (IllegalArgumentException ex) {
            log.warn("pdf convert request invalid, pdfPath={}, error={}",
                request == null ? "" : request.getPdfPath(), ex.getMessage());
            return ConversionOutcome.builder()
                .success(false)
                .message(ex.getMessage())
                .build();
        } catch (Exception ex) {
            log.warn("pdf convert failed, pdfPath={}, error={}",
                request == null ? "" : request.getPdfPath(), ex.getMessage(), ex);
            return ConversionOutcome.builder()
                .success(false)
                .message("convert failed: " + ex.getMessage())
                .build();
        }
    }

    private Path validateRequest(PdfConvertRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        if (StringUtils.isBlank(request.getPdfPath())) {
            throw new IllegalArgumentException("pdfPath is blank");
        }
        Path document = Paths.get(request.getPdfPath().trim()).toAbsolutePath();
        if (!Files.isRegularFile(document)) {
            throw new IllegalArgumentException("pdf file not found: " + document);
        }
        if (!document.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new IllegalArgumentException("not a pdf file: " + document);
        }
        return document;
    }

    private ConversionTarget resolveTarget(PdfConvertRequest request, Path document) {
        String outputDir = StringUtils.firstNonBlank(request.getOutputDir(), convertProperties.getOutputDir());
        Path dir = StringUtils.isBlank(outputDir)
            ? document.getParent()
            : Paths.get(outputDir.trim()).toAbsolutePath();

        String fileName = document.getFileName().toString();
        String stem = fileName.substring(0, fileName.length() - ".pdf".length());
        String name = FilenameSanitizer.sanitize(
            StringUtils.defaultIfBlank(request.getOutputName(), stem), MAX_OUTPUT_NAME_LENGTH);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("outputName is blank after sanitizing");
        }
        return new ConversionTarget(dir, name);
    }

}
