package xyz.jphil.pdf_annotate.tools.exec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import xyz.jphil.pdf_annotate.tools.LogFormatter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner(new LogFormatter(1));

    @Test
    void zeroExitSucceeds() {
        runner.run(List.of("sh", "-c", "exit 0"));
    }

    @Test
    void nonZeroExitNamesTheCommandAndCode() {
        var e = assertThrows(ToolInvocationException.class, () -> runner.run(List.of("sh", "-c", "exit 3")));
        assertTrue(e.getMessage().contains("exit code 3"), e.getMessage());
        assertTrue(e.getMessage().contains("sh"), e.getMessage());
    }

    @Test
    void unknownProgramCannotBeStarted() {
        var e = assertThrows(ToolInvocationException.class,
            () -> runner.run(List.of("no-such-program-pdf-annotate")));
        assertTrue(e.getMessage().contains("could not be started"), e.getMessage());
    }

    @Test
    void capturedOutputIsDecodedAsUtf8() throws Exception {
        assertEquals("Version: ImageMagick \u00e9", ProcessCommandRunner.capture(
            List.of("sh", "-c", "printf 'Version: ImageMagick \\303\\251'")));
    }
}
