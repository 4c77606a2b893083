package xyz.jphil.pdf_annotate.tools;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import xyz.jphil.pdf_annotate.tools.exec.ConfigurationException;
import xyz.jphil.pdf_annotate.tools.imaging.Gravity;
import xyz.jphil.pdf_annotate.tools.pipeline.PipelineConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnotateToolTest {

    @TempDir
    Path dir;

    private String input;
    private String output;

    @BeforeEach
    void createInput() throws IOException {
        input = Files.writeString(dir.resolve("L1-A.pdf"), "").toString();
        output = dir.resolve("out.pdf").toString();
    }

    private static PipelineConfig config(String... args) {
        CommandLine cl = AnnotateTool.commandLine();
        cl.parseArgs(args);
        AnnotateTool tool = cl.getCommand();
        return tool.toConfig();
    }

    @Test
    void defaultsDisableOptionalStages() {
        var config = config("-o", output, input);

        assertEquals(300, config.dpi());
        assertTrue(Math.abs(config.layout().width() - 2550) <= 1);
        assertFalse(config.mergeEnabled());
        assertFalse(config.labelEnabled());
        assertFalse(config.numberEnabled());
        assertNull(config.label());
        assertTrue(config.concurrency() >= 1);
    }

    @Test
    void labelAndNumberOptionsBuildOverlays() {
        var config = config("-o", output, "--dpi", "100", "--size", "254x254",
            "--label-sep", "-", "--label-gravity", "north-west", "--label-color", "blue",
            "--number-start", "3", "--number-format", "Page %d", "--number-font", "DejaVu-Sans",
            input);

        assertEquals("-", config.labelSeparator());
        assertEquals(Gravity.NORTH_WEST, config.label().gravity());
        assertEquals(Gravity.WEST, config.label().style().alignment());
        assertEquals("blue", config.label().style().color());
        assertEquals(3, config.numberStart());
        assertEquals("Page %d", config.numberFormat());
        assertEquals(Gravity.SOUTH, config.number().gravity());
        assertEquals("DejaVu-Sans", config.number().style().font());
    }

    @Test
    void emptyLabelSeparatorIsRejected() {
        assertThrows(ConfigurationException.class, () -> config("-o", output, "--label-sep", "", input));
    }

    @Test
    void invalidNumberFormatIsRejected() {
        var e = assertThrows(ConfigurationException.class,
            () -> config("-o", output, "--number-start", "1", "--number-format", "%q", input));
        assertTrue(e.getMessage().startsWith("--number-format"), e.getMessage());
    }

    @Test
    void missingOutputDirectoryIsRejected() {
        String nested = dir.resolve("missing").resolve("out.pdf").toString();
        assertThrows(ConfigurationException.class, () -> config("-o", nested, input));
    }

    @Test
    void unreadableHeaderIsRejected() {
        String header = dir.resolve("nope.png").toString();
        assertThrows(ConfigurationException.class, () -> config("-o", output, "--header", header, input));
    }

    @Test
    void badSizeFailsBeforeAnyToolIsUsed() {
        assertEquals(1, AnnotateTool.commandLine().execute("--size", "abc", "-o", output, input));
    }

    @Test
    void missingSourceFailsTheRun() {
        assertEquals(1, AnnotateTool.commandLine().execute("-o", output, dir.resolve("nothing.pdf").toString()));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, AnnotateTool.commandLine().execute(input));
        assertEquals(2, AnnotateTool.commandLine().execute("-o", output, "--label-gravity", "middle", input));
        assertEquals(2, AnnotateTool.commandLine().execute("-o", output, "--renderer", "mupdf", input));
    }

    @Test
    void rendererIsCaseInsensitive() {
        CommandLine cl = AnnotateTool.commandLine();
        var result = cl.parseArgs("-o", output, "--renderer", "pdfbox", input);
        assertEquals(AnnotateTool.Renderer.PDFBOX, result.matchedOptionValue("--renderer", AnnotateTool.Renderer.GS));
    }
}
