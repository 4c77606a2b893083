package xyz.jphil.pdf_annotate.tools.imaging;

import java.nio.file.Path;
import java.util.List;

/**
 * Pixel operations used by the pipeline. Every operation reads and writes files and
 * throws {@link xyz.jphil.pdf_annotate.tools.exec.ToolInvocationException} on failure.
 */
public interface ImageComposer {

    /**
     * Shrink or grow {@code source} to fit inside width x height, then pad it to exactly
     * that canvas with the image anchored at {@code gravity}.
     */
    void fitToCanvas(Path source, Path target, int width, int height, Gravity gravity, boolean strip);

    /**
     * Stack the images top to bottom into one image.
     */
    void appendVertically(List<Path> parts, Path target);

    /**
     * Render {@code text} on a transparent width x height canvas.
     */
    void renderText(String text, Path target, int width, int height, TextStyle style);

    /**
     * Composite {@code foreground} onto {@code background} at the anchor plus margin.
     */
    void overlay(Path foreground, Path background, Path target, Gravity gravity, int marginX, int marginY);

    /**
     * Assemble the pages, in order, into one paginated PDF at the given resolution.
     */
    void assemble(List<Path> pages, Path target, int width, int height, int dpi);
}
