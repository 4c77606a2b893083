package xyz.jphil.pdf_annotate.tools.ordering;

import java.nio.file.Path;
import java.util.Comparator;

/**
 * File stem helpers: the file name without directory and last extension.
 */
public final class Stems {

    private Stems() {
    }

    public static String of(Path path) {
        Path name = path.getFileName();
        return name == null ? "" : of(name.toString());
    }

    /**
     * Leading dots belong to the stem, so ".hidden" has no extension.
     */
    public static String of(String fileName) {
        int firstNonDot = 0;
        while (firstNonDot < fileName.length() && fileName.charAt(firstNonDot) == '.') {
            firstNonDot++;
        }
        int dot = fileName.lastIndexOf('.');
        return dot > firstNonDot ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Extension including the dot, or "" when there is none.
     */
    public static String extension(String fileName) {
        return fileName.substring(of(fileName).length());
    }

    public static Comparator<Path> byNaturalStem() {
        return Comparator.comparing(p -> NaturalKey.of(of(p)));
    }
}
