package xyz.jphil.pdf_annotate.tools;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.pdf_annotate.tools.exec.AnnotateException;
import xyz.jphil.pdf_annotate.tools.exec.BoundedTaskScheduler;
import xyz.jphil.pdf_annotate.tools.exec.ConfigurationException;
import xyz.jphil.pdf_annotate.tools.exec.ProcessCommandRunner;
import xyz.jphil.pdf_annotate.tools.exec.ToolLocator;
import xyz.jphil.pdf_annotate.tools.imaging.Gravity;
import xyz.jphil.pdf_annotate.tools.imaging.ImageMagickComposer;
import xyz.jphil.pdf_annotate.tools.pdf.GhostscriptRasterizer;
import xyz.jphil.pdf_annotate.tools.pdf.PdfBoxRasterizer;
import xyz.jphil.pdf_annotate.tools.pdf.RasterService;
import xyz.jphil.pdf_annotate.tools.pipeline.Dimensions;
import xyz.jphil.pdf_annotate.tools.pipeline.OverlaySpec;
import xyz.jphil.pdf_annotate.tools.pipeline.PageLayout;
import xyz.jphil.pdf_annotate.tools.pipeline.PipelineConfig;
import xyz.jphil.pdf_annotate.tools.pipeline.PipelineDriver;
import xyz.jphil.pdf_annotate.tools.pipeline.StageRunner;
import xyz.jphil.pdf_annotate.tools.pipeline.WorkDirectory;
import xyz.jphil.pdf_annotate.tools.source.SourceResolver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Annotates pages from source PDFs and collects them into a single PDF.
 * Built with PicoCLI for argument parsing and help generation.
 */
@Command(
    name = "pdf-annotate",
    mixinStandardHelpOptions = true,
    version = "1.0",
    description = {
        "Annotate pages from source PDFs and collect them into a single PDF.",
        "",
        "Directories contribute all .pdf files within. Inputs are sorted in combined",
        "alphanumeric order of their names, segmented on whitespace, '-' and '_'",
        "(D1, L1, L2, L10); --keep-order disables sorting.",
        "",
        "Header and footer images are attached to every page and the page is shrunk to fit.",
        "With --label-sep, the part of the file name before the separator labels each page:",
        "L1-VENDOR-FIXTURE.pdf with --label-sep - is labeled \"L1\".",
        "With --number-start, pages are numbered consecutively in output order.",
        "",
        "Pages are rendered with Ghostscript (or PDFBox, --renderer pdfbox) and processed",
        "with ImageMagick; every page of the output is a bitmap."
    }
)
public class AnnotateTool implements Callable<Integer> {

    public enum Renderer { GS, PDFBOX }

    static final String LINUX_DEFAULT_FONT = "Bitstream-Vera-Sans-Bold";

    @Parameters(arity = "1..*", paramLabel = "PDF_OR_DIR", description = "Source PDF files or directories")
    private List<Path> sources;

    @Option(names = {"-o", "--output"}, required = true, description = "Output pdf file")
    private Path output;

    @Option(names = {"--numbered-output"}, description = "Write out.N.pdf instead of overwriting an existing output")
    private boolean numberedOutput;

    @Option(names = {"--keep-order"}, description = "Keep source PDF order instead of sorting them alphanumerically")
    private boolean keepOrder;

    @Option(names = {"--dpi"}, paramLabel = "DPI", description = "Processing DPI (default: ${DEFAULT-VALUE})")
    private int dpi = 300;

    @Option(names = {"--size"}, paramLabel = "WIDTHxHEIGHT", description = "Paper size in millimeters (default: ${DEFAULT-VALUE})")
    private String size = "215.9x279.4";

    @Option(names = {"--header"}, paramLabel = "IMAGE", description = "Header image to use")
    private Path header;

    @Option(names = {"--header-height"}, paramLabel = "PCT", description = "Header height in percents of the page height (default: ${DEFAULT-VALUE})")
    private double headerHeight = 10;

    @Option(names = {"--footer"}, paramLabel = "IMAGE", description = "Footer image to use")
    private Path footer;

    @Option(names = {"--footer-height"}, paramLabel = "PCT", description = "Footer height in percents of the page height (default: ${DEFAULT-VALUE})")
    private double footerHeight = 20;

    @Option(names = {"--label-sep"}, paramLabel = "SEPARATOR", description = "File name label separator, enables labeling")
    private String labelSep;

    @Option(names = {"--label-height"}, paramLabel = "PCT", description = "Label height in percents of the page height (default: ${DEFAULT-VALUE})")
    private double labelHeight = 5;

    @Option(names = {"--label-margin"}, paramLabel = "XPCTxYPCT", description = "Margin around label in percents of label height (default: ${DEFAULT-VALUE})")
    private String labelMargin = "70x125";

    @Option(names = {"--label-color"}, paramLabel = "COLOR", description = "Label color (default: ${DEFAULT-VALUE})")
    private String labelColor = "red";

    @Option(names = {"--label-font"}, paramLabel = "FONT", description = "Label font, \"convert -list font\" to see the font list")
    private String labelFont;

    @Option(names = {"--label-gravity"}, paramLabel = "GRAVITY", converter = Gravity.Converter.class,
        description = "Label position on the page (default: ${DEFAULT-VALUE})")
    private Gravity labelGravity = Gravity.SOUTH_EAST;

    @Option(names = {"--number-start"}, paramLabel = "N", description = "First page number, enables page numbering")
    private Integer numberStart;

    @Option(names = {"--number-height"}, paramLabel = "PCT", description = "Page number height in percents of the page height (default: ${DEFAULT-VALUE})")
    private double numberHeight = 3;

    @Option(names = {"--number-margin"}, paramLabel = "XPCTxYPCT", description = "Margin around page number in percents of its height (default: ${DEFAULT-VALUE})")
    private String numberMargin = "0x100";

    @Option(names = {"--number-color"}, paramLabel = "COLOR", description = "Page number color (default: ${DEFAULT-VALUE})")
    private String numberColor = "black";

    @Option(names = {"--number-font"}, paramLabel = "FONT", description = "Page number font")
    private String numberFont;

    @Option(names = {"--number-gravity"}, paramLabel = "GRAVITY", converter = Gravity.Converter.class,
        description = "Page number position on the page (default: ${DEFAULT-VALUE})")
    private Gravity numberGravity = Gravity.SOUTH;

    @Option(names = {"--number-format"}, paramLabel = "FORMAT", description = "Page number text, a printf pattern (default: ${DEFAULT-VALUE})")
    private String numberFormat = "%d";

    @Option(names = {"--renderer"}, paramLabel = "RENDERER", description = "Page renderer: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Renderer renderer = Renderer.GS;

    @Option(names = {"--concurrency"}, description = "Maximum concurrency (default: number of processors)")
    private int concurrency = Runtime.getRuntime().availableProcessors();

    @Option(names = {"--tempdir"}, paramLabel = "DIR", description = "Explicit temporary directory, kept for debugging")
    private Path tempDir;

    @Option(names = {"--progress"}, description = "Show per-stage progress bars")
    private boolean progress;

    @Option(names = {"-v", "--verbose"}, description = "Verbose output, repeat for more (-vv)")
    private boolean[] verbose = new boolean[0];

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new AnnotateTool()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        var log = ProgressAwareLogFormatter.create(verbose.length);
        WorkDirectory workDir = null;
        try {
            PipelineConfig config = toConfig();
            List<Path> documents = new SourceResolver(log).resolve(sources, keepOrder);
            if (documents.isEmpty()) {
                throw new ConfigurationException("No source PDFs found in " + sources);
            }

            var tools = ToolLocator.system(log);
            var commandRunner = new ProcessCommandRunner(log);
            RasterService rasterizer = renderer == Renderer.GS
                ? new GhostscriptRasterizer(tools.ghostscript(), commandRunner)
                : new PdfBoxRasterizer();
            var composer = new ImageMagickComposer(tools.imageMagick(), commandRunner);

            log.info("SETUP", String.format("paper=%s mm, %d documents", size, documents.size()));
            workDir = WorkDirectory.open(tempDir, log);

            var scheduler = new BoundedTaskScheduler(config.concurrency(), log);
            var runner = new StageRunner(scheduler, log, config.showProgress());
            var driver = new PipelineDriver(config, rasterizer, composer, runner, log, workDir.path());

            Path written = driver.run(documents);
            workDir.cleanUp();
            log.complete("DONE", "Wrote " + written);
            return 0;

        } catch (AnnotateException e) {
            log.error("ERROR", e.getMessage());
            if (log.isTraceEnabled()) {
                e.printStackTrace();
            }
            if (workDir != null) {
                workDir.retain();
            }
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (log.isDebugEnabled()) {
                e.printStackTrace();
            }
            if (workDir != null) {
                workDir.retain();
            }
            return 1;
        }
    }

    /**
     * Validates the options and derives pixel geometry. Throws before any tool is looked up.
     */
    PipelineConfig toConfig() {
        var paper = Dimensions.parsePositive(size, "--size", "WIDTHxHEIGHT");
        var layout = PageLayout.compute(paper, dpi,
            header != null ? headerHeight : null,
            footer != null ? footerHeight : null);

        requireReadable(header, "--header");
        requireReadable(footer, "--footer");
        if (labelSep != null && labelSep.isEmpty()) {
            throw new ConfigurationException("--label-sep must not be empty");
        }
        if (concurrency < 1) {
            throw new ConfigurationException("--concurrency must be at least 1 (got " + concurrency + ")");
        }
        Path outputDir = output.toAbsolutePath().getParent();
        if (outputDir != null && !Files.isDirectory(outputDir)) {
            throw new ConfigurationException("Output directory \"" + outputDir + "\" does not exist");
        }

        OverlaySpec label = null;
        if (labelSep != null) {
            var margin = Dimensions.parseNonNegative(labelMargin, "--label-margin", "XPCTxYPCT");
            label = OverlaySpec.of(layout, labelHeight, margin, labelGravity, labelColor, fontOrDefault(labelFont));
        }
        OverlaySpec number = null;
        if (numberStart != null) {
            var margin = Dimensions.parseNonNegative(numberMargin, "--number-margin", "XPCTxYPCT");
            number = OverlaySpec.of(layout, numberHeight, margin, numberGravity, numberColor, fontOrDefault(numberFont));
            checkNumberFormat(numberFormat);
        }

        return PipelineConfig.builder()
            .dpi(dpi)
            .layout(layout)
            .header(header)
            .footer(footer)
            .labelSeparator(labelSep)
            .label(label)
            .numberStart(numberStart)
            .numberFormat(numberFormat)
            .number(number)
            .concurrency(concurrency)
            .output(output)
            .numberedOutput(numberedOutput)
            .showProgress(progress)
            .build();
    }

    private static void requireReadable(Path image, String option) {
        if (image != null && !Files.isReadable(image)) {
            throw new ConfigurationException(option + " image \"" + image + "\" is not readable");
        }
    }

    private static void checkNumberFormat(String format) {
        try {
            String.format(format, 1);
        } catch (IllegalFormatException e) {
            throw new ConfigurationException("--number-format \"" + format + "\" is not a valid pattern ("
                + e.getMessage() + ")", e);
        }
    }

    /**
     * ImageMagick's default font is missing on many Linux installs.
     */
    private static String fontOrDefault(String font) {
        if (font != null) return font;
        boolean linux = System.getProperty("os.name", "").toLowerCase().contains("linux");
        return linux ? LINUX_DEFAULT_FONT : null;
    }
}
