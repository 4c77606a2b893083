package xyz.jphil.pdf_annotate.tools.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;

/**
 * Utility for extracting basic PDF information
 */
public class PdfInfoUtil {

    public static int getPageCount(Path pdfFile) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfFile.toFile())) {
            return document.getNumberOfPages();
        }
    }

    /**
     * Page count, or empty when PDFBox cannot parse the file (Ghostscript may still manage).
     */
    public static OptionalInt pageCount(Path pdfFile) {
        try {
            return OptionalInt.of(getPageCount(pdfFile));
        } catch (IOException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Sum of page counts for the render summary. Unreadable files count as one page.
     */
    public static int estimateTotalPages(List<Path> pdfFiles) {
        return pdfFiles.stream()
            .mapToInt(p -> pageCount(p).orElse(1))
            .sum();
    }
}
