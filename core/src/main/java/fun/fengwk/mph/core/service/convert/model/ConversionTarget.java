package fun.fengwk.mph.core.service.convert.model;

import java.nio.file.Path;

/**
 * Where a conversion writes {@code {outputName}.md} and its image directory.
 *
 * @author fengwk
 */
public record ConversionTarget(Path outputDir, String outputName) {

    public Path markdownPath() {
        return outputDir.resolve(outputName + ".md");
    }

    public Path imageDir() {
        return outputDir.resolve(outputName + "_images");
    }

}
