package xyz.jphil.pdf_annotate.tools.exec;

import java.util.List;

/**
 * Runs one external command to completion.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @throws ToolInvocationException if the command cannot be launched or exits non-zero
     */
    void run(List<String> command);
}
