package xyz.jphil.pdf_annotate.tools.exec;

import lombok.RequiredArgsConstructor;
import xyz.jphil.pdf_annotate.tools.LogFormatter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Runs external commands as child processes sharing this process's stdout/stderr.
 * There is no timeout: an unresponsive tool blocks its worker until it exits.
 */
@RequiredArgsConstructor
public class ProcessCommandRunner implements CommandRunner {

    private final LogFormatter log;

    @Override
    public void run(List<String> command) {
        log.debug("EXEC", "Running " + command);

        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        } catch (IOException e) {
            throw new ToolInvocationException(
                String.format("command %s could not be started (%s)", command, e.getMessage()), e);
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(String.format("command %s was interrupted", command), e);
        }

        if (exitCode != 0) {
            throw ToolInvocationException.exitCode(command, exitCode);
        }
    }

    /**
     * Runs the command and returns its combined output, used for version checks.
     */
    public static String capture(List<String> command) throws IOException, InterruptedException {
        var process = new ProcessBuilder(command).redirectErrorStream(true).start();
        byte[] output = process.getInputStream().readAllBytes();
        process.waitFor();
        return new String(output, StandardCharsets.UTF_8);
    }
}
