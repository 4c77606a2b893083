package xyz.jphil.pdf_annotate.tools.exec;

import java.util.List;

/**
 * An external render or composite process exited non-zero, could not be launched,
 * or did not produce the expected output.
 */
public class ToolInvocationException extends AnnotateException {

    public ToolInvocationException(String message) {
        super(message);
    }

    public ToolInvocationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ToolInvocationException exitCode(List<String> command, int exitCode) {
        return new ToolInvocationException(
            String.format("command %s failed (exit code %d)", command, exitCode));
    }
}
