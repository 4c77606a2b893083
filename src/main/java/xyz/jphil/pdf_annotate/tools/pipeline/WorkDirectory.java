package xyz.jphil.pdf_annotate.tools.pipeline;

import lombok.Getter;
import lombok.experimental.Accessors;
import xyz.jphil.pdf_annotate.tools.LogFormatter;
import xyz.jphil.pdf_annotate.tools.exec.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Holds the intermediate artifacts of one run. A generated directory is deleted after a
 * successful run; an explicit {@code --tempdir} and the directory of a failed run are kept.
 */
@Getter
@Accessors(fluent = true)
public class WorkDirectory {

    private final Path path;
    private final boolean explicit;
    private final LogFormatter log;

    private WorkDirectory(Path path, boolean explicit, LogFormatter log) {
        this.path = path;
        this.explicit = explicit;
        this.log = log;
    }

    public static WorkDirectory open(Path explicitDir, LogFormatter log) {
        if (explicitDir != null) {
            try {
                Files.createDirectories(explicitDir);
            } catch (IOException e) {
                throw new ConfigurationException(
                    "Cannot create --tempdir \"" + explicitDir + "\" (" + e.getMessage() + ")", e);
            }
            return new WorkDirectory(explicitDir, true, log);
        }
        try {
            return new WorkDirectory(Files.createTempDirectory("pdf-annotate-"), false, log);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to create temporary directory (" + e.getMessage() + ")", e);
        }
    }

    public void cleanUp() {
        if (explicit) {
            log.debug("TEMP", "Keeping " + path);
            return;
        }
        try (Stream<Path> files = Files.walk(path)) {
            for (Path p : files.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warning("TEMP", "Failed to remove " + path + " (" + e.getMessage() + ")");
        }
    }

    /**
     * Leaves the artifacts of a failed run in place for inspection.
     */
    public void retain() {
        log.info("TEMP", "Intermediate files left in " + path);
    }
}
