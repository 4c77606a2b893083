package xyz.jphil.pdf_annotate.tools.imaging;

import lombok.RequiredArgsConstructor;
import xyz.jphil.pdf_annotate.tools.exec.CommandRunner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ImageComposer} backed by ImageMagick's convert and composite commands.
 */
@RequiredArgsConstructor
public class ImageMagickComposer implements ImageComposer {

    private final MagickCommands commands;
    private final CommandRunner runner;

    @Override
    public void fitToCanvas(Path source, Path target, int width, int height, Gravity gravity, boolean strip) {
        var args = new ArrayList<String>();
        args.add(source.toString());
        if (strip) {
            args.add("-strip");
        }
        args.addAll(List.of(
            "-resize", size(width, height),
            "-gravity", gravity.magickName(),
            "-extent", size(width, height),
            target.toString()));
        convert(args);
    }

    @Override
    public void appendVertically(List<Path> parts, Path target) {
        var args = new ArrayList<String>();
        args.add("-append");
        parts.forEach(p -> args.add(p.toString()));
        args.add("-strip");
        args.add(target.toString());
        convert(args);
    }

    @Override
    public void renderText(String text, Path target, int width, int height, TextStyle style) {
        var args = new ArrayList<String>();
        if (style.font() != null) {
            args.addAll(List.of("-font", style.font()));
        }
        args.addAll(List.of(
            "-background", "none",
            "-fill", style.color(),
            "-size", size(width, height),
            "-gravity", style.alignment().magickName(),
            "label:" + escapeLabel(text),
            target.toString()));
        convert(args);
    }

    @Override
    public void overlay(Path foreground, Path background, Path target, Gravity gravity, int marginX, int marginY) {
        var cmd = new ArrayList<>(commands.composite());
        cmd.addAll(List.of(
            "-gravity", gravity.magickName(),
            "-geometry", gravity.geometry(marginX, marginY),
            foreground.toString(),
            background.toString(),
            target.toString()));
        runner.run(cmd);
    }

    @Override
    public void assemble(List<Path> pages, Path target, int width, int height, int dpi) {
        var args = new ArrayList<String>(List.of(
            "-format", "pdf",
            "-resize", size(width, height),
            "-units", "PixelsPerInch",
            "-density", String.valueOf(dpi)));
        pages.forEach(p -> args.add(p.toString()));
        args.add(target.toString());
        convert(args);
    }

    private void convert(List<String> args) {
        var cmd = new ArrayList<>(commands.convert());
        cmd.addAll(args);
        runner.run(cmd);
    }

    private static String size(int width, int height) {
        return width + "x" + height;
    }

    /**
     * label: treats a leading '@' as a file reference and '%' as an escape.
     */
    static String escapeLabel(String text) {
        String escaped = text.replace("\\", "\\\\").replace("%", "%%");
        return escaped.startsWith("@") ? "\\" + escaped : escaped;
    }
}
