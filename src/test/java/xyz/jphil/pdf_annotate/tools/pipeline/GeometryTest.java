package xyz.jphil.pdf_annotate.tools.pipeline;

import org.junit.jupiter.api.Test;
import xyz.jphil.pdf_annotate.tools.exec.ConfigurationException;
import xyz.jphil.pdf_annotate.tools.imaging.Gravity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeometryTest {

    @Test
    void parsesDimensions() {
        assertEquals(new Dimensions(215.9, 279.4), Dimensions.parsePositive("215.9x279.4", "--size", "WIDTHxHEIGHT"));
        assertEquals(new Dimensions(0, 100), Dimensions.parseNonNegative("0x100", "--number-margin", "XPCTxYPCT"));
    }

    @Test
    void rejectsMalformedDimensions() {
        for (String bad : new String[]{"abc", "10", "1x2x3", "x5", "NaNx1", "10X20"}) {
            var e = assertThrows(ConfigurationException.class,
                () -> Dimensions.parsePositive(bad, "--size", "WIDTHxHEIGHT"), bad);
            assertTrue(e.getMessage().startsWith("--size must be in the format WIDTHxHEIGHT"), e.getMessage());
        }
    }

    @Test
    void enforcesSign() {
        assertThrows(ConfigurationException.class, () -> Dimensions.parsePositive("0x5", "--size", "WIDTHxHEIGHT"));
        assertThrows(ConfigurationException.class,
            () -> Dimensions.parseNonNegative("10x-1", "--label-margin", "XPCTxYPCT"));
    }

    @Test
    void letterPageAtPrintResolution() {
        var layout = PageLayout.compute(new Dimensions(215.9, 279.4), 300, 10.0, 20.0);

        assertTrue(Math.abs(layout.width() - 2550) <= 1, layout.toString());
        assertTrue(Math.abs(layout.height() - 3300) <= 1, layout.toString());
        assertEquals(PageLayout.percentOf(layout.height(), 10), layout.headerHeight());
        assertEquals(PageLayout.percentOf(layout.height(), 20), layout.footerHeight());
        assertEquals(layout.height(), layout.headerHeight() + layout.bodyHeight() + layout.footerHeight());
    }

    @Test
    void bodyTakesTheWholePageWithoutBanners() {
        var layout = PageLayout.compute(new Dimensions(100, 200), 100, null, null);
        assertEquals(0, layout.headerHeight());
        assertEquals(0, layout.footerHeight());
        assertEquals(layout.height(), layout.bodyHeight());
    }

    @Test
    void oversizedBannersAreRejected() {
        var e = assertThrows(ConfigurationException.class,
            () -> PageLayout.compute(new Dimensions(100, 200), 100, 60.0, 60.0));
        assertTrue(e.getMessage().startsWith("Some heights came out negative"), e.getMessage());
    }

    @Test
    void overlayIsSizedFromPageHeight() {
        var layout = new PageLayout(2000, 1000, 0, 1000, 0);
        var spec = OverlaySpec.of(layout, 5, new Dimensions(70, 125), Gravity.SOUTH_EAST, "red", null);

        assertEquals(50, spec.height());
        assertEquals(35, spec.marginX());
        assertEquals(62, spec.marginY());
        assertEquals(Gravity.EAST, spec.style().alignment());
        assertEquals("red", spec.style().color());
    }

    @Test
    void textFollowsHorizontalAnchor() {
        assertEquals(Gravity.WEST, OverlaySpec.textAlignment(Gravity.NORTH_WEST));
        assertEquals(Gravity.CENTER, OverlaySpec.textAlignment(Gravity.SOUTH));
        assertEquals(Gravity.EAST, OverlaySpec.textAlignment(Gravity.EAST));
    }
}
