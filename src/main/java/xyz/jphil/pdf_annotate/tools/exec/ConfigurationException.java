package xyz.jphil.pdf_annotate.tools.exec;

/**
 * Invalid option value, invalid source path or missing input. Raised before any work starts.
 */
public class ConfigurationException extends AnnotateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
