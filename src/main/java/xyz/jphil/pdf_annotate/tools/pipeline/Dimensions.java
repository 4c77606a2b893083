package xyz.jphil.pdf_annotate.tools.pipeline;

import xyz.jphil.pdf_annotate.tools.exec.ConfigurationException;

/**
 * A pair of numbers written as {@code XxY}, e.g. a paper size {@code 215.9x279.4}
 * or a margin {@code 70x125}.
 */
public record Dimensions(double x, double y) {

    public static Dimensions parsePositive(String value, String option, String format) {
        var d = parse(value, option, format);
        if (d.x() <= 0 || d.y() <= 0) {
            throw invalid(option, format, "must be positive");
        }
        return d;
    }

    public static Dimensions parseNonNegative(String value, String option, String format) {
        var d = parse(value, option, format);
        if (d.x() < 0 || d.y() < 0) {
            throw invalid(option, format, "must be 0 or positive");
        }
        return d;
    }

    private static Dimensions parse(String value, String option, String format) {
        String[] parts = value.trim().split("x", -1);
        if (parts.length != 2) {
            throw invalid(option, format, "got \"" + value + "\"");
        }
        try {
            double x = Double.parseDouble(parts[0]);
            double y = Double.parseDouble(parts[1]);
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                throw invalid(option, format, "got \"" + value + "\"");
            }
            return new Dimensions(x, y);
        } catch (NumberFormatException e) {
            throw invalid(option, format, "got \"" + value + "\"");
        }
    }

    private static ConfigurationException invalid(String option, String format, String detail) {
        return new ConfigurationException(option + " must be in the format " + format + " (" + detail + ")");
    }

    @Override
    public String toString() {
        return x + "x" + y;
    }
}
