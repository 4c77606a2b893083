package xyz.jphil.pdf_annotate.tools.imaging;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Anchor position of an overlay on its background, named after ImageMagick's gravity values.
 */
public enum Gravity {
    NORTH_WEST("NorthWest"),
    NORTH("North"),
    NORTH_EAST("NorthEast"),
    WEST("West"),
    CENTER("Center"),
    EAST("East"),
    SOUTH_WEST("SouthWest"),
    SOUTH("South"),
    SOUTH_EAST("SouthEast");

    private final String magickName;

    Gravity(String magickName) {
        this.magickName = magickName;
    }

    public String magickName() {
        return magickName;
    }

    /**
     * ImageMagick geometry for an offset measured inwards from the anchored edges.
     */
    public String geometry(int marginX, int marginY) {
        return String.format("+%d+%d", marginX, marginY);
    }

    /**
     * Accepts "SouthEast", "southeast", "south-east" and "SOUTH_EAST".
     */
    public static Gravity parse(String value) {
        String normalized = value.replaceAll("[-_\\s]", "").toLowerCase(Locale.ROOT);
        for (Gravity g : values()) {
            if (g.magickName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return g;
            }
        }
        throw new IllegalArgumentException("unknown gravity '" + value + "', expected one of "
            + Arrays.stream(values()).map(Gravity::magickName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return magickName;
    }

    public static class Converter implements ITypeConverter<Gravity> {
        @Override
        public Gravity convert(String value) {
            try {
                return parse(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
}
