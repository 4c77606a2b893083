package xyz.jphil.pdf_annotate.tools;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogFormatterTest {

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalErr;

    @BeforeEach
    void captureStderr() {
        originalErr = System.err;
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStderr() {
        System.setErr(originalErr);
    }

    private String stderr() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    @Test
    void stageStartAndCollectSuccessAreAlwaysShown() {
        var log = new LogFormatter(0);

        log.step("RESIZED", "4 tasks");
        log.success("COLLECT", "Assembled 4 pages");

        assertTrue(stderr().contains("▶️ [RESIZED] 4 tasks"), stderr());
        assertTrue(stderr().contains("✅ [COLLECT] Assembled 4 pages"), stderr());
    }

    @Test
    void debugNeedsVerbosityOne() {
        new LogFormatter(0).debug("RENDER", "hidden");
        new LogFormatter(1).debug("RENDER", "shown");
        new LogFormatter(1).trace("ORDER", "hidden too");

        assertFalse(stderr().contains("hidden"), stderr());
        assertTrue(stderr().contains("[RENDER] shown"), stderr());
    }
}
