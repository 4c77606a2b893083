package xyz.jphil.pdf_annotate.tools.exec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import xyz.jphil.pdf_annotate.tools.LogFormatter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisabledOnOs(OS.WINDOWS)
class ToolLocatorTest {

    @TempDir
    Path bin;

    private final LogFormatter log = new LogFormatter(0);

    private Path executable(String name) throws IOException {
        Path file = Files.writeString(bin.resolve(name), "#!/bin/sh\nexit 0\n");
        file.toFile().setExecutable(true);
        return file;
    }

    private ToolLocator locator(boolean everythingIsImageMagick) {
        return new ToolLocator(List.of(bin), false, p -> everythingIsImageMagick, log);
    }

    @Test
    void findsGhostscriptOnSearchPath() throws IOException {
        Path gs = executable("gs");
        assertEquals(gs, locator(true).ghostscript());
    }

    @Test
    void missingGhostscriptIsReported() {
        var e = assertThrows(ToolNotFoundException.class, () -> locator(true).ghostscript());
        assertEquals("Ghostscript is not found. Please install from https://www.ghostscript.com/", e.getMessage());
    }

    @Test
    void nonExecutableFilesAreIgnored() throws IOException {
        Path gs = Files.writeString(bin.resolve("gs"), "not a program");
        gs.toFile().setExecutable(false);
        assertEquals(Optional.empty(), locator(true).findBin("gs", null));
    }

    @Test
    void prefersMagickFrontEnd() throws IOException {
        Path magick = executable("magick");
        executable("convert");
        executable("composite");

        var commands = locator(true).imageMagick();
        assertEquals(List.of(magick.toString(), "convert"), commands.convert());
        assertEquals(List.of(magick.toString(), "composite"), commands.composite());
    }

    @Test
    void fallsBackToLegacyBinaries() throws IOException {
        Path convert = executable("convert");
        Path composite = executable("composite");

        var commands = locator(true).imageMagick();
        assertEquals(List.of(convert.toString()), commands.convert());
        assertEquals(List.of(composite.toString()), commands.composite());
    }

    @Test
    void binariesThatAreNotImageMagickAreRejected() throws IOException {
        executable("convert");
        executable("composite");
        assertThrows(ToolNotFoundException.class, () -> locator(false).imageMagick());
    }

    @Test
    void legacyPairMustBeComplete() throws IOException {
        executable("convert");
        assertThrows(ToolNotFoundException.class, () -> locator(true).imageMagick());
    }
}
