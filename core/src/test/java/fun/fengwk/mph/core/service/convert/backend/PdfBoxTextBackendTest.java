package fun.fengwk.mph.core.service.convert.backend;

import fun.fengwk.mph.core.service.convert.ConvertProperties;
import fun.fengwk.mph.core.service.convert.MarkdownPostProcessor;
import fun.fengwk.mph.core.service.convert.PdfDocuments;
import fun.fengwk.mph.core.service.convert.model.ConversionOutcome;
import fun.fengwk.mph.core.service.convert.model.ConversionTarget;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
@Slf4j
public class PdfBoxTextBackendTest {

    @TempDir
    Path tempDir;

    private ConvertProperties convertProperties;
    private PdfBoxTextBackend backend;

    @BeforeEach
    void setUp() {
        convertProperties = new ConvertProperties();
        backend = new PdfBoxTextBackend(convertProperties, new MarkdownPostProcessor());
    }

    @Test
    public void testConvertTextAndHeadings() throws Exception {
        Path pdf = PdfDocuments.textPdf(tempDir.resolve("paper.pdf"), List.of(
            List.of("1 Introduction", "Deep learning is used widely."),
            List.of("RESULTS", "The method works well.")), false);
        ConversionTarget target = new ConversionTarget(tempDir.resolve("out"), "paper");

        ConversionOutcome outcome = backend.convert(pdf, target);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getPageCount()).isEqualTo(2);
        assertThat(outcome.getImageCount()).isZero();
        assertThat(outcome.getBackendUsed()).isEqualTo("pdfbox");
        String markdown = Files.readString(target.markdownPath(), StandardCharsets.UTF_8);
        log.info("pdfbox markdown:\n{}", markdown);
        assertThat(markdown).contains("## 1 Introduction", "Deep learning is used widely.", "## RESULTS", "---");
        assertThat(markdown).doesNotContain("## Deep learning");
    }

    @Test
    public void testImagesAreExported() throws Exception {
        Path pdf = PdfDocuments.textPdf(tempDir.resolve("figure.pdf"), List.of(List.of("Figure page")), true);
        ConversionTarget target = new ConversionTarget(tempDir, "figure");

        ConversionOutcome outcome = backend.convert(pdf, target);

        assertThat(outcome.getImageCount()).isEqualTo(1);
        assertThat(tempDir.resolve("figure_images/page1_img1.png")).exists();
        assertThat(Files.readString(target.markdownPath())).contains("![image](figure_images/page1_img1.png)");
    }

    @Test
    public void testImageExportCanBeDisabled() throws Exception {
        convertProperties.setExtractImages(false);
        Path pdf = PdfDocuments.textPdf(tempDir.resolve("figure.pdf"), List.of(List.of("Figure page")), true);

        ConversionOutcome outcome = backend.convert(pdf, new ConversionTarget(tempDir, "figure"));

        assertThat(outcome.getImageCount()).isZero();
        assertThat(tempDir.resolve("figure_images")).doesNotExist();
    }

    @Test
    public void testBrokenDocumentFails() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.pdf"), "not a pdf");

        ConversionOutcome outcome = backend.convert(broken, new ConversionTarget(tempDir, "broken"));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).startsWith("pdfbox conversion failed");
    }

    @Test
    public void testHeadingHeuristic() {
        assertThat(backend.isHeading("2. Related Work")).isTrue();
        assertThat(backend.isHeading("ABSTRACT")).isTrue();
        assertThat(backend.isHeading("A normal sentence.")).isFalse();
        assertThat(backend.isHeading("2024")).isFalse();
        assertThat(backend.isHeading("1 " + "x".repeat(100))).isFalse();
    }

}
