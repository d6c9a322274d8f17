package fun.fengwk.mph.core.service.convert;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Generates small PDF documents for conversion tests.
 *
 * @author fengwk
 */
public final class PdfDocuments {

    private PdfDocuments() {
    }

    /**
     * One page per entry, every page holds its lines top down.
     */
    public static Path textPdf(Path file, List<List<String>> pages, boolean withImage) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (List<String> lines : pages) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    if (!lines.isEmpty()) {
                        stream.beginText();
                        stream.setFont(PDType1Font.HELVETICA, 12);
                        stream.newLineAtOffset(72, 700);
                        for (String line : lines) {
                            stream.showText(line);
                            stream.newLineAtOffset(0, -24);
                        }
                        stream.endText();
                    }
                    if (withImage) {
                        PDImageXObject image = LosslessFactory.createFromImage(document, squareImage());
                        stream.drawImage(image, 72, 300, 64, 64);
                    }
                }
            }
            document.save(file.toFile());
        }
        return file;
    }

    private static BufferedImage squareImage() {
        BufferedImage image = new BufferedImage(32, 32, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        graphics.setColor(Color.BLUE);
        graphics.fillRect(0, 0, 32, 32);
        graphics.dispose();
        return image;
    }

}
