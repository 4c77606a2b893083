package xyz.jphil.pdf_annotate.tools.exec;

/**
 * A required external tool is not installed or not discoverable.
 */
public class ToolNotFoundException extends AnnotateException {

    public ToolNotFoundException(String message) {
        super(message);
    }
}
