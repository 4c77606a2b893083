package xyz.jphil.pdf_annotate.tools.pipeline;

import java.nio.file.Path;

/**
 * A file produced by one stage. {@code identity} threads the artifact back to its source
 * page; {@code sourceStem} is the stem of the document it descends from.
 */
public record Artifact(Stage stage, String identity, String sourceStem, Path path) {

    static final String IMAGE_EXT = "png";

    public static Artifact in(Path workDir, Stage stage, String identity, String sourceStem) {
        return new Artifact(stage, identity, sourceStem, workDir.resolve(stage.fileName(identity, IMAGE_EXT)));
    }

    /**
     * The same page as produced by the next stage, next to this artifact.
     */
    public Artifact advance(Stage next) {
        return in(path.getParent(), next, identity, sourceStem);
    }

    public String fileName() {
        return path.getFileName().toString();
    }
}
