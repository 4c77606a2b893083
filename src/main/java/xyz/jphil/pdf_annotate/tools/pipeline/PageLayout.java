package xyz.jphil.pdf_annotate.tools.pipeline;

import xyz.jphil.pdf_annotate.tools.exec.ConfigurationException;

/**
 * Pixel geometry of an output page: header, body and footer stacked vertically.
 */
public record PageLayout(int width, int height, int headerHeight, int bodyHeight, int footerHeight) {

    public static final double MM_PER_IN = 25.4;

    /**
     * @param headerPct header height in percents of the page height, null when there is no header
     * @param footerPct footer height in percents of the page height, null when there is no footer
     */
    public static PageLayout compute(Dimensions paperMm, int dpi, Double headerPct, Double footerPct) {
        if (dpi <= 0) {
            throw new ConfigurationException("--dpi must be positive (got " + dpi + ")");
        }
        int width = (int) (paperMm.x() / MM_PER_IN * dpi);
        int height = (int) (paperMm.y() / MM_PER_IN * dpi);
        if (width <= 0 || height <= 0) {
            throw new ConfigurationException(String.format(
                "paper %s at %d dpi is smaller than one pixel", paperMm, dpi));
        }

        int header = headerPct == null ? 0 : percentOf(height, headerPct);
        int footer = footerPct == null ? 0 : percentOf(height, footerPct);
        int body = height - header - footer;

        if (header < 0 || body < 0 || footer < 0) {
            throw new ConfigurationException(String.format(
                "Some heights came out negative (header:body:footer=%d:%d:%d)", header, body, footer));
        }
        return new PageLayout(width, height, header, body, footer);
    }

    static int percentOf(int pixels, double pct) {
        return (int) (pixels * pct / 100.0);
    }

    @Override
    public String toString() {
        return String.format("pixels=%dx%d header:body:footer=%d:%d:%d",
            width, height, headerHeight, bodyHeight, footerHeight);
    }
}
