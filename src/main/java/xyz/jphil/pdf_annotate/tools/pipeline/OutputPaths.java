package xyz.jphil.pdf_annotate.tools.pipeline;

import xyz.jphil.pdf_annotate.tools.ordering.Stems;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Chooses where the collected document is written.
 */
public final class OutputPaths {

    private OutputPaths() {
    }

    /**
     * In numbered mode an existing target is never overwritten: {@code out.pdf} becomes the
     * first free one of {@code out.1.pdf}, {@code out.2.pdf}, ...
     */
    public static Path select(Path target, boolean numbered) {
        if (!numbered || !Files.exists(target)) {
            return target;
        }
        String fileName = target.getFileName().toString();
        String stem = Stems.of(fileName);
        String ext = Stems.extension(fileName);
        for (int n = 1; ; n++) {
            Path candidate = target.resolveSibling(stem + "." + n + ext);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }
}
