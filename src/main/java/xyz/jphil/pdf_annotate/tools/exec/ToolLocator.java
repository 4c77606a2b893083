package xyz.jphil.pdf_annotate.tools.exec;

import lombok.RequiredArgsConstructor;
import xyz.jphil.pdf_annotate.tools.LogFormatter;
import xyz.jphil.pdf_annotate.tools.imaging.MagickCommands;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Finds Ghostscript and ImageMagick binaries on the search path, falling back to the
 * default install directories on Windows.
 */
@RequiredArgsConstructor
public class ToolLocator {

    private static final String GS_WINDOWS_GLOB = "C:/Program Files/gs/gs*/bin/gswin*c.exe";
    private static final String MAGICK_WINDOWS_GLOB = "C:/Program Files/ImageMagick*/magick.exe";

    private final List<Path> searchPath;
    private final boolean windows;
    private final Predicate<Path> isImageMagick;
    private final LogFormatter log;

    public static ToolLocator system(LogFormatter log) {
        String path = System.getenv().getOrDefault("PATH", "");
        List<Path> dirs = Arrays.stream(path.split(File.pathSeparator))
            .filter(s -> !s.isBlank())
            .map(Paths::get)
            .toList();
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("windows");
        return new ToolLocator(dirs, windows, ToolLocator::reportsImageMagick, log);
    }

    public Path ghostscript() {
        return findBin("gs", GS_WINDOWS_GLOB)
            .or(() -> windows ? findBin("gswin64c", null) : Optional.empty())
            .orElseThrow(() -> new ToolNotFoundException(
                "Ghostscript is not found. Please install from https://www.ghostscript.com/"));
    }

    /**
     * Prefers the ImageMagick 7 {@code magick} front end, else the legacy convert/composite pair.
     */
    public MagickCommands imageMagick() {
        var magick = findMagickBin("magick", MAGICK_WINDOWS_GLOB);
        if (magick.isPresent()) {
            String bin = magick.get().toString();
            log.debug("TOOLS", "ImageMagick: " + bin);
            return new MagickCommands(List.of(bin, "convert"), List.of(bin, "composite"));
        }
        var convert = findMagickBin("convert", null);
        var composite = findMagickBin("composite", null);
        if (convert.isEmpty() || composite.isEmpty()) {
            throw new ToolNotFoundException("ImageMagick is not found. Please install from https://imagemagick.org");
        }
        log.debug("TOOLS", "ImageMagick: " + convert.get() + ", " + composite.get());
        return new MagickCommands(List.of(convert.get().toString()), List.of(composite.get().toString()));
    }

    Optional<Path> findBin(String cmd, String windowsGlob) {
        for (Path dir : searchPath) {
            for (String name : candidateNames(cmd)) {
                Path candidate = dir.resolve(name);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        if (windowsGlob == null || !windows) {
            return Optional.empty();
        }
        return firstGlobMatch(windowsGlob);
    }

    private Optional<Path> findMagickBin(String cmd, String windowsGlob) {
        // Windows ships an unrelated convert.exe, so every candidate must identify itself
        return findBin(cmd, windowsGlob).filter(isImageMagick);
    }

    private List<String> candidateNames(String cmd) {
        return windows ? List.of(cmd + ".exe", cmd) : List.of(cmd);
    }

    static boolean reportsImageMagick(Path bin) {
        try {
            return ProcessCommandRunner.capture(List.of(bin.toString(), "-version")).contains("ImageMagick");
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Expands a glob whose wildcards may appear in any path element, returning the first hit.
     */
    Optional<Path> firstGlobMatch(String glob) {
        String[] parts = glob.split("/");
        List<Path> current = new ArrayList<>();
        current.add(Paths.get(parts[0] + File.separator));
        for (int i = 1; i < parts.length; i++) {
            List<Path> next = new ArrayList<>();
            for (Path dir : current) {
                if (!parts[i].contains("*")) {
                    Path p = dir.resolve(parts[i]);
                    if (Files.exists(p)) next.add(p);
                    continue;
                }
                if (!Files.isDirectory(dir)) continue;
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, parts[i])) {
                    stream.forEach(next::add);
                } catch (IOException e) {
                    log.debug("TOOLS", "Skipping unreadable " + dir + " (" + e.getMessage() + ")");
                }
            }
            next.sort(null);
            current = next;
        }
        return current.stream().filter(Files::isRegularFile).findFirst();
    }
}
