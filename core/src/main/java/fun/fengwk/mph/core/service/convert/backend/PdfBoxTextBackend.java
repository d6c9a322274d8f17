package fun.fengwk.mph.core.service.convert.backend;

import fun.fengwk.mph.core.service.convert.ConvertProperties;
import fun.fengwk.mph.core.service.convert.MarkdownPostProcessor;
import fun.fengwk.mph.core.service.convert.model.ConversionOutcome;
import fun.fengwk.mph.core.service.convert.model.ConversionTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Lightweight text layer extraction with a heading heuristic and embedded image export.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfBoxTextBackend implements ConversionBackend {

    public static final String NAME = "pdfbox";

    private static final Pattern NUMBERED_HEADING_PATTERN = Pattern.compile("^\\d+\\.?\\s+\\S.*");

    private final ConvertProperties convertProperties;
    private final MarkdownPostProcessor markdownPostProcessor;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ConversionOutcome convert(Path document, ConversionTarget target) {
        try (PDDocument pdDocument = PDDocument.load(document.toFile())) {
            Files.createDirectories(target.outputDir());
            PDFTextStripper stripper = new PDFTextStripper();
            StringBuilder markdown = new StringBuilder();
            int imageCount = 0;
            int pageCount = pdDocument.getNumberOfPages();
            for (int i = 0; i < pageCount; i++) {
                if (i > 0) {
                    markdown.append("\n\n---\n\n");
                }
                stripper.setStartPage(i + 1);
                stripper.setEndPage(i + 1);
                appendPageText(markdown, stripper.getText(pdDocument));
                if (convertProperties.isExtractImages()) {
                    imageCount += exportImages(pdDocument.getPage(i), i + 1, target, markdown);
                }
            }

            String content = convertProperties.isPostProcess()
                ? markdownPostProcessor.process(markdown.toString(), convertProperties.isGenerateToc())
                : markdown.toString();
            Files.writeString(target.markdownPath(), content, StandardCharsets.UTF_8);
            log.info("pdfbox conversion finished, document={}, pages={}, images={}", document, pageCount, imageCount);
            return ConversionOutcome.builder()
                .success(true)
                .markdownPath(target.markdownPath().toAbsolutePath().toString())
                .imageCount(imageCount)
                .pageCount(pageCount)
                .backendUsed(NAME)
                .message("converted " + pageCount + " pages")
                .build();
        } catch (IOException | RuntimeException ex) {
            log.warn("pdfbox conversion failed, document={}, error={}", document, ex.getMessage());
            return ConversionOutcome.builder()
                .success(false)
                .backendUsed(NAME)
                .message("pdfbox conversion failed: " + ex.getMessage())
                .build();
        }
    }

    private void appendPageText(StringBuilder markdown, String pageText) {
        for (String rawLine : pageText.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                markdown.append('\n');
            } else if (isHeading(line)) {
                markdown.append("\n## ").append(line).append("\n\n");
            } else {
                markdown.append(line).append('\n');
            }
        }
    }

    boolean isHeading(String line) {
        if (line.length() >= convertProperties.getHeadingMaxLength()) {
            return false;
        }
        return isAllUpperCase(line) || NUMBERED_HEADING_PATTERN.matcher(line).matches();
    }

    private static boolean isAllUpperCase(String line) {
        boolean hasCased = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                hasCased = true;
            }
        }
        return hasCased;
    }

    private int exportImages(PDPage page, int pageNumber, ConversionTarget target, StringBuilder markdown)
        throws IOException {
        PDResources resources = page.getResources();
        if (resources == null) {
            return 0;
        }
        int exported = 0;
        for (COSName name : resources.getXObjectNames()) {
            PDXObject xObject;
            try {
                xObject = resources.getXObject(name);
            } catch (IOException ex) {
                log.debug("read xobject failed, page={}, name={}, error={}", pageNumber, name.getName(), ex.getMessage());
                continue;
            }
            if (!(xObject instanceof PDImageXObject image)) {
                continue;
            }
            Files.createDirectories(target.imageDir());
            String filename = "page" + pageNumber + "_img" + (exported + 1) + ".png";
            try {
                ImageIO.write(image.getImage(), "png", target.imageDir().resolve(filename).toFile());
            } catch (IOException ex) {
                log.debug("export image failed, page={}, file={}, error={}", pageNumber, filename, ex.getMessage());
                continue;
            }
            exported++;
            markdown.append("\n![image](").append(target.outputName()).append("_images/").append(filename).append(")\n");
        }
        return exported;
    }

}
