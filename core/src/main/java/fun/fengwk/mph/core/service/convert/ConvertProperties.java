package fun.fengwk.mph.core.service.convert;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Document classification and conversion configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mph.convert")
public class ConvertProperties {

    /**
     * Pages sampled for classification.
     */
    private int samplePages = 3;

    /**
     * Readable character ratio below which a sample is garbled.
     */
    private double readableRatioThreshold = 0.5;

    /**
     * Repeated run ratio above which a sample is garbled.
     */
    private double repeatRatioThreshold = 0.1;

    /**
     * Length of an identical character run counted as repetition.
     */
    private int repeatRunLength = 3;

    /**
     * Lightweight text layer backend name.
     */
    private String lightweightBackend = "pdfbox";

    /**
     * OCR backend name.
     */
    private String ocrBackend = "deepseek_ocr";

    /**
     * Default output directory, empty means next to the input document.
     */
    private String outputDir = "";

    /**
     * Whether embedded images are exported.
     */
    private boolean extractImages = true;

    /**
     * Max length of a line treated as a heading candidate.
     */
    private int headingMaxLength = 80;

    /**
     * Whether converted markdown is post processed.
     */
    private boolean postProcess = true;

    /**
     * Whether a table of contents is generated during post processing.
     */
    private boolean generateToc = false;

    /**
     * OCR API key, empty disables OCR routing.
     */
    private String ocrApiKey = "";

    /**
     * OpenAI compatible OCR API base url.
     */
    private String ocrBaseUrl = "https://api.siliconflow.cn/v1";

    /**
     * OCR model name.
     */
    private String ocrModel = "deepseek-ai/DeepSeek-OCR";

    /**
     * Render resolution of OCR page images.
     */
    private float ocrRenderDpi = 144;

    /**
     * Max tokens per OCR page.
     */
    private int ocrMaxTokens = 4096;

    /**
     * OCR sampling temperature.
     */
    private double ocrTemperature = 0.1;

    /**
     * Timeout of one OCR API call in milliseconds.
     */
    private long ocrTimeoutMs = 120000;

    /**
     * Prompt sent with each page image.
     */
    private String ocrPrompt = """
        Convert this academic paper page to Markdown.
        1. Keep the original paragraph structure.
        2. Use # levels for headings.
        3. Write formulas in LaTeX, $ inline and $$ for display.
        4. Write tables as Markdown tables.
        5. Keep the reference list format.
        6. Output only the recognized content without explanations.""";

    public boolean hasOcrCredential() {
        return StringUtils.isNotBlank(ocrApiKey);
    }

}
