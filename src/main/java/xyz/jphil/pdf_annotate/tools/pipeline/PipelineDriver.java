package xyz.jphil.pdf_annotate.tools.pipeline;

import lombok.RequiredArgsConstructor;
import xyz.jphil.pdf_annotate.tools.LogFormatter;
import xyz.jphil.pdf_annotate.tools.exec.ToolInvocationException;
import xyz.jphil.pdf_annotate.tools.exec.WorkItem;
import xyz.jphil.pdf_annotate.tools.imaging.Gravity;
import xyz.jphil.pdf_annotate.tools.imaging.ImageComposer;
import xyz.jphil.pdf_annotate.tools.ordering.NaturalKey;
import xyz.jphil.pdf_annotate.tools.ordering.Stems;
import xyz.jphil.pdf_annotate.tools.pdf.PdfInfoUtil;
import xyz.jphil.pdf_annotate.tools.pdf.RasterService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the stages render, resize, merge, label, number and collect in sequence,
 * threading the ordered artifact list from one stage to the next. Merge, label and
 * number are skipped when their configuration is absent.
 */
@RequiredArgsConstructor
public class PipelineDriver {

    static final String HEADER_FILE = "__HEADER__.png";
    static final String FOOTER_FILE = "__FOOTER__.png";

    private final PipelineConfig config;
    private final RasterService rasterizer;
    private final ImageComposer composer;
    private final StageRunner runner;
    private final LogFormatter log;
    private final Path workDir;

    /**
     * @return the path the output document was written to
     */
    public Path run(List<Path> documents) {
        log.info("SETUP", config.layout().toString());
        log.debug("SETUP", "documents=" + documents + " workdir=" + workDir);

        List<Artifact> pages = render(SourceDocument.identify(documents));
        pages = resize(pages);
        if (config.mergeEnabled()) {
            pages = merge(pages);
        }
        if (config.labelEnabled()) {
            pages = label(pages);
        }
        if (config.numberEnabled()) {
            pages = number(pages, new PageNumberSequence(config.numberStart()));
        }
        return collect(pages);
    }

    /**
     * One task per document. Pages are gathered afterwards from the expected file names,
     * document by document, so the result follows source order and then page order.
     */
    List<Artifact> render(List<SourceDocument> sources) {
        if (log.isDebugEnabled()) {
            log.debug("RENDER", String.format("%d documents, about %d pages",
                sources.size(), PdfInfoUtil.estimateTotalPages(sources.stream().map(SourceDocument::path).toList())));
        }
        discardStalePages(sources);
        var items = new ArrayList<WorkItem>(sources.size());
        for (SourceDocument source : sources) {
            items.add(WorkItem.of("render " + source.path(), () -> {
                log.info("RENDER", "Rendering " + source.stem() + "...");
                rasterizer.rasterize(source.path(), config.dpi(), workDir, Stage.SRC.baseName(source.identity()));
            }));
        }
        runner.runAll(Stage.SRC.name(), items);

        Set<String> produced = listWorkDir();
        var pages = new ArrayList<Artifact>();
        for (SourceDocument source : sources) {
            List<Artifact> documentPages = pagesOf(source, produced);
            if (documentPages.isEmpty()) {
                log.warning("RENDER", source.path() + " produced no pages");
            }
            pages.addAll(documentPages);
        }
        log.debug("RENDER", "pages=" + pages.stream().map(Artifact::fileName).toList());
        return pages;
    }

    private static Pattern pagePattern(SourceDocument source) {
        return Pattern.compile(
            Pattern.quote(Stage.SRC.baseName(source.identity())) + "-([0-9]+)\\." + Artifact.IMAGE_EXT);
    }

    /**
     * A reused work directory may still hold pages of an earlier, longer document with the
     * same identity. They are removed so only this run's pages are collected.
     */
    private void discardStalePages(List<SourceDocument> sources) {
        Set<String> existing = listWorkDir();
        for (SourceDocument source : sources) {
            Pattern pattern = pagePattern(source);
            for (String name : existing) {
                if (!pattern.matcher(name).matches()) continue;
                try {
                    Files.deleteIfExists(workDir.resolve(name));
                    log.debug("RENDER", "Discarded stale page " + name);
                } catch (IOException e) {
                    throw new ToolInvocationException("Failed to remove stale page " + workDir.resolve(name), e);
                }
            }
        }
    }

    private List<Artifact> pagesOf(SourceDocument source, Set<String> produced) {
        Pattern pagePattern = pagePattern(source);
        return produced.stream()
            .map(pagePattern::matcher)
            .filter(Matcher::matches)
            .map(m -> Artifact.in(workDir, Stage.SRC, source.identity() + "-" + m.group(1), source.stem()))
            .sorted(Comparator.comparing(a -> NaturalKey.of(Stems.of(a.fileName()))))
            .toList();
    }

    private Set<String> listWorkDir() {
        try (Stream<Path> files = Files.list(workDir)) {
            return files.map(p -> p.getFileName().toString()).collect(Collectors.toSet());
        } catch (IOException e) {
            throw new ToolInvocationException("Failed to list rendered pages in " + workDir, e);
        }
    }

    List<Artifact> resize(List<Artifact> pages) {
        PageLayout layout = config.layout();
        return runner.mapEach(Stage.RESIZED, "Resizing", pages, (in, out) ->
            composer.fitToCanvas(in.path(), out.path(), layout.width(), layout.bodyHeight(), Gravity.CENTER, true));
    }

    /**
     * Header and footer are fitted to the page width once, then stacked around every body.
     */
    List<Artifact> merge(List<Artifact> pages) {
        PageLayout layout = config.layout();
        Path header = config.header() == null ? null : workDir.resolve(HEADER_FILE);
        Path footer = config.footer() == null ? null : workDir.resolve(FOOTER_FILE);

        var prepare = new ArrayList<WorkItem>();
        if (header != null) {
            prepare.add(fitBanner(config.header(), header, layout.headerHeight()));
        }
        if (footer != null) {
            prepare.add(fitBanner(config.footer(), footer, layout.footerHeight()));
        }
        runner.runAll("PREPARE", prepare);

        return runner.mapEach(Stage.MERGED, "Merging", pages, (in, out) -> {
            var parts = new ArrayList<Path>(3);
            if (header != null) parts.add(header);
            parts.add(in.path());
            if (footer != null) parts.add(footer);
            composer.appendVertically(parts, out.path());
        });
    }

    private WorkItem fitBanner(Path image, Path target, int height) {
        int width = config.layout().width();
        return WorkItem.of("resize " + image, () -> {
            log.info("PREPARE", String.format("Resizing %s to %dx%d", image, width, height));
            composer.fitToCanvas(image, target, width, height, Gravity.WEST, false);
        });
    }

    /**
     * Renders one label image per distinct label value, then composites it onto every page
     * whose source stem carries that value.
     */
    List<Artifact> label(List<Artifact> pages) {
        OverlaySpec spec = config.label();
        int width = config.layout().width();

        Map<String, Artifact> byValue = new LinkedHashMap<>();
        Map<String, Artifact> labelMap = new HashMap<>();
        var items = new ArrayList<WorkItem>();
        for (Artifact page : pages) {
            String value = labelOf(page.sourceStem(), config.labelSeparator());
            Artifact labelImage = byValue.computeIfAbsent(value, v -> {
                Artifact a = Artifact.in(workDir, Stage.LABEL, v, page.sourceStem());
                items.add(WorkItem.of("label " + v, () -> {
                    log.info(Stage.LABEL.name(), "Generating label \"" + v + "\"...");
                    composer.renderText(v, a.path(), width, spec.height(), spec.style());
                    StageRunner.requireOutput(a);
                }));
                return a;
            });
            labelMap.put(page.identity(), labelImage);
        }
        log.debug(Stage.LABEL.name(), "labels=" + byValue.keySet());
        runner.runAll(Stage.LABEL.name(), items);

        return runner.mapEach(Stage.LABELED, "Labeling", pages, (in, out) ->
            composer.overlay(labelMap.get(in.identity()).path(), in.path(), out.path(),
                spec.gravity(), spec.marginX(), spec.marginY()));
    }

    /**
     * The part of the stem before the first separator, or the whole stem.
     */
    static String labelOf(String stem, String separator) {
        int idx = stem.indexOf(separator);
        return idx < 0 ? stem : stem.substring(0, idx);
    }

    /**
     * Numbers are drawn from the sequence in page order before any task is dispatched.
     */
    List<Artifact> number(List<Artifact> pages, PageNumberSequence sequence) {
        OverlaySpec spec = config.number();
        int width = config.layout().width();

        Map<String, Artifact> numberMap = new HashMap<>();
        var items = new ArrayList<WorkItem>(pages.size());
        for (Artifact page : pages) {
            int n = sequence.next();
            String text = String.format(config.numberFormat(), n);
            Artifact numberImage = Artifact.in(workDir, Stage.NUMBER, String.valueOf(n), page.sourceStem());
            numberMap.put(page.identity(), numberImage);
            items.add(WorkItem.of("number " + text, () -> {
                log.debug(Stage.NUMBER.name(), "Generating number \"" + text + "\" for " + page.identity());
                composer.renderText(text, numberImage.path(), width, spec.height(), spec.style());
                StageRunner.requireOutput(numberImage);
            }));
        }
        runner.runAll(Stage.NUMBER.name(), items);

        return runner.mapEach(Stage.NUMBERED, "Numbering", pages, (in, out) ->
            composer.overlay(numberMap.get(in.identity()).path(), in.path(), out.path(),
                spec.gravity(), spec.marginX(), spec.marginY()));
    }

    Path collect(List<Artifact> pages) {
        if (pages.isEmpty()) {
            throw new ToolInvocationException("no pages were rendered, nothing to collect");
        }
        Path target = OutputPaths.select(config.output(), config.numberedOutput());
        log.info("COLLECT", "Collecting " + pages.size() + " annotated pages into " + target);
        PageLayout layout = config.layout();
        composer.assemble(pages.stream().map(Artifact::path).toList(), target,
            layout.width(), layout.height(), config.dpi());
        if (!Files.isRegularFile(target)) {
            throw new ToolInvocationException("expected output " + target + " was not produced");
        }
        log.success("COLLECT", "Assembled " + pages.size() + " pages");
        return target;
    }
}
