package xyz.jphil.pdf_annotate.tools.imaging;

import java.util.List;

/**
 * Command prefixes for the two ImageMagick front ends, e.g. {@code [magick, convert]}
 * for ImageMagick 7 or {@code [/usr/bin/convert]} for the legacy binaries.
 */
public record MagickCommands(List<String> convert, List<String> composite) {

    public MagickCommands {
        convert = List.copyOf(convert);
        composite = List.copyOf(composite);
    }
}
