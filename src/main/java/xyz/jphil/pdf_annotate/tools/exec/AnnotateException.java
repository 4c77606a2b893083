package xyz.jphil.pdf_annotate.tools.exec;

/**
 * Base of every failure that aborts a run. None of them is retried.
 */
public abstract class AnnotateException extends RuntimeException {

    protected AnnotateException(String message) {
        super(message);
    }

    protected AnnotateException(String message, Throwable cause) {
        super(message, cause);
    }
}
