package xyz.jphil.pdf_annotate.tools.pipeline;

/**
 * Pipeline phase that produced an artifact. The constant name is the file name prefix.
 */
public enum Stage {
    SRC,
    RESIZED,
    MERGED,
    LABEL,
    LABELED,
    NUMBER,
    NUMBERED;

    /**
     * {@code {STAGE}_{IDENTITY}.{ext}}
     */
    public String fileName(String identity, String ext) {
        return baseName(identity) + "." + ext;
    }

    public String baseName(String identity) {
        return name() + "_" + identity;
    }
}
