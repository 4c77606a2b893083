package xyz.jphil.pdf_annotate.tools.pipeline;

import xyz.jphil.pdf_annotate.tools.imaging.Gravity;
import xyz.jphil.pdf_annotate.tools.imaging.TextStyle;

/**
 * Size, placement and style of a text overlay (page label or page number).
 * Overlay images span the full page width; the text is aligned inside them.
 */
public record OverlaySpec(int height, int marginX, int marginY, Gravity gravity, TextStyle style) {

    /**
     * @param heightPct overlay height in percents of the page height
     * @param marginPct margins in percents of the overlay height
     */
    public static OverlaySpec of(PageLayout layout, double heightPct, Dimensions marginPct,
                                 Gravity gravity, String color, String font) {
        int height = PageLayout.percentOf(layout.height(), heightPct);
        return new OverlaySpec(height,
            PageLayout.percentOf(height, marginPct.x()),
            PageLayout.percentOf(height, marginPct.y()),
            gravity,
            new TextStyle(color, font, textAlignment(gravity)));
    }

    /**
     * Horizontal part of the anchor, so the text sits on the same side as the overlay.
     */
    static Gravity textAlignment(Gravity gravity) {
        return switch (gravity) {
            case NORTH_WEST, WEST, SOUTH_WEST -> Gravity.WEST;
            case NORTH_EAST, EAST, SOUTH_EAST -> Gravity.EAST;
            case NORTH, CENTER, SOUTH -> Gravity.CENTER;
        };
    }
}
