package xyz.jphil.pdf_annotate.tools.imaging;

/**
 * How a text overlay is rendered. A null font leaves the choice to ImageMagick.
 */
public record TextStyle(String color, String font, Gravity alignment) {
}
