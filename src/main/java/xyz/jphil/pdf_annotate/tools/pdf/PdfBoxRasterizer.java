package xyz.jphil.pdf_annotate.tools.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import xyz.jphil.pdf_annotate.tools.exec.ToolInvocationException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * In-process renderer using Apache PDFBox, for machines without Ghostscript.
 * Produces the same page names as {@link GhostscriptRasterizer}.
 */
public class PdfBoxRasterizer implements RasterService {

    @Override
    public void rasterize(Path document, int dpi, Path outputDir, String baseName) {
        try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
            PDFRenderer renderer = new PDFRenderer(pdf);
            for (int page = 0; page < pdf.getNumberOfPages(); page++) {
                BufferedImage image = renderer.renderImageWithDPI(page, dpi, ImageType.RGB);
                Path target = outputDir.resolve(RasterService.pageFileName(baseName, page + 1));
                if (!ImageIO.write(image, "png", target.toFile())) {
                    throw new ToolInvocationException("no PNG writer available for " + target);
                }
            }
        } catch (IOException e) {
            throw new ToolInvocationException(
                String.format("PDFBox failed to render %s (%s)", document, e.getMessage()), e);
        }
    }
}
