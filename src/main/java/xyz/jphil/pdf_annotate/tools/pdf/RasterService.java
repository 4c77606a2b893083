package xyz.jphil.pdf_annotate.tools.pdf;

import java.nio.file.Path;

/**
 * Converts one document into one PNG per page.
 */
public interface RasterService {

    /**
     * Render every page of {@code document} at {@code dpi} into {@code outputDir}, naming the
     * pages {@code baseName-1.png}, {@code baseName-2.png} and so on.
     *
     * @throws xyz.jphil.pdf_annotate.tools.exec.ToolInvocationException if rendering fails
     */
    void rasterize(Path document, int dpi, Path outputDir, String baseName);

    /**
     * Page file name pattern with Ghostscript's {@code %d} page placeholder. A literal '%'
     * in the base name is doubled so Ghostscript does not read it as a format directive.
     */
    static String pagePattern(String baseName) {
        return baseName.replace("%", "%%") + "-%d.png";
    }

    /**
     * File name of one rendered page, 1-based.
     */
    static String pageFileName(String baseName, int page) {
        return baseName + "-" + page + ".png";
    }
}
