package fun.fengwk.mph.core.service.convert.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.mph.core.service.convert.ConvertProperties;
import fun.fengwk.mph.core.service.convert.MarkdownPostProcessor;
import fun.fengwk.mph.core.service.convert.model.ConversionOutcome;
import fun.fengwk.mph.core.service.convert.model.ConversionTarget;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;

/**
 * OCR extraction: every page is rendered to PNG and sent to an OpenAI compatible vision chat completion API.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class OcrApiConversionBackend implements ConversionBackend {

    public static final String NAME = "deepseek_ocr";

    private final ConvertProperties convertProperties;
    private final MarkdownPostProcessor markdownPostProcessor;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    @Autowired
    public OcrApiConversionBackend(ConvertProperties convertProperties, MarkdownPostProcessor markdownPostProcessor) {
        this(convertProperties, markdownPostProcessor, new ObjectMapper(), HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(15))
            .build());
    }

    OcrApiConversionBackend(
        ConvertProperties convertProperties,
        MarkdownPostProcessor markdownPostProcessor,
        ObjectMapper objectMapper,
        HttpClient httpClient
    ) {
        this.convertProperties = convertProperties;
        this.markdownPostProcessor = markdownPostProcessor;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ConversionOutcome convert(Path document, ConversionTarget target) {
        if (!convertProperties.hasOcrCredential()) {
            return failure("ocr api key is not configured");
        }

        try (PDDocument pdDocument = PDDocument.load(document.toFile())) {
            Files.createDirectories(target.outputDir());
            PDFRenderer renderer = new PDFRenderer(pdDocument);
            int pageCount = pdDocument.getNumberOfPages();
            int recognized = 0;
            StringBuilder markdown = new StringBuilder();
            for (int i = 0; i < pageCount; i++) {
                if (i > 0) {
                    markdown.append("\n\n---\n\n");
                }
                markdown.append("<!-- page ").append(i + 1).append(" -->\n\n");
                String pageMarkdown = recognizePage(renderer, i);
                if (StringUtils.isBlank(pageMarkdown)) {
                    markdown.append("<!-- page ").append(i + 1).append(": ocr failed -->\n");
                    continue;
                }
                recognized++;
                markdown.append(pageMarkdown.trim()).append('\n');
            }

            if (pageCount > 0 && recognized == 0) {
                return failure("ocr failed for every page");
            }

            String content = convertProperties.isPostProcess()
                ? markdownPostProcessor.process(markdown.toString(), convertProperties.isGenerateToc())
                : markdown.toString();
            Files.writeString(target.markdownPath(), content, StandardCharsets.UTF_8);
            log.info("ocr conversion finished, document={}, pages={}, recognized={}", document, pageCount, recognized);
            return ConversionOutcome.builder()
                .success(true)
                .markdownPath(target.markdownPath().toAbsolutePath().toString())
                .pageCount(pageCount)
                .backendUsed(NAME)
                .message("recognized " + recognized + " of " + pageCount + " pages")
                .build();
        } catch (IOException | RuntimeException ex) {
            log.warn("ocr conversion failed, document={}, error={}", document, ex.getMessage());
            return failure("ocr conversion failed: " + ex.getMessage());
        }
    }

    private String recognizePage(PDFRenderer renderer, int pageIndex) {
        try {
            BufferedImage image = renderer.renderImageWithDPI(pageIndex, convertProperties.getOcrRenderDpi(), ImageType.RGB);
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            ImageIO.write(image, "png", output);
            return callApi(Base64.getEncoder().encodeToString(output.toByteArray()));
        } catch (IOException ex) {
            log.warn("ocr page failed, page={}, error={}", pageIndex + 1, ex.getMessage());
            return "";
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("ocr page interrupted, page={}", pageIndex + 1);
            return "";
        }
    }

    private String callApi(String imageBase64) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(
                StringUtils.removeEnd(convertProperties.getOcrBaseUrl(), "/") + "/chat/completions"))
            .header("Authorization", "Bearer " + convertProperties.getOcrApiKey())
            .header("Content-Type", "application/json")
            .timeout(Duration.ofMillis(convertProperties.getOcrTimeoutMs()))
            .POST(HttpRequest.BodyPublishers.ofString(buildPayload(imageBase64), StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() != 200) {
            throw new IOException("ocr api status " + response.statusCode());
        }
        JsonNode root = objectMapper.readTree(response.body());
        return root.path("choices").path(0).path("message").path("content").asText("");
    }

    String buildPayload(String imageBase64) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", convertProperties.getOcrModel());
        payload.put("max_tokens", convertProperties.getOcrMaxTokens());
        payload.put("temperature", convertProperties.getOcrTemperature());
        ArrayNode messages = payload.putArray("messages");
        ObjectNode message = messages.addObject();
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        content.addObject()
            .put("type", "text")
            .put("text", convertProperties.getOcrPrompt());
        content.addObject()
            .put("type", "image_url")
            .putObject("image_url")
            .put("url", "data:image/png;base64," + imageBase64);
        return objectMapper.writeValueAsString(payload);
    }

    private ConversionOutcome failure(String message) {
        return ConversionOutcome.builder()
            .success(false)
            .backendUsed(NAME)
            .message(message)
            .build();
    }

}
