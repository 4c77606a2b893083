package xyz.jphil.pdf_annotate.tools.pdf;

import lombok.RequiredArgsConstructor;
import xyz.jphil.pdf_annotate.tools.exec.CommandRunner;

import java.nio.file.Path;
import java.util.List;

/**
 * Renders pages with Ghostscript's png16m device.
 */
@RequiredArgsConstructor
public class GhostscriptRasterizer implements RasterService {

    private final Path gsBin;
    private final CommandRunner runner;

    @Override
    public void rasterize(Path document, int dpi, Path outputDir, String baseName) {
        runner.run(command(document, dpi, outputDir, baseName));
    }

    List<String> command(Path document, int dpi, Path outputDir, String baseName) {
        return List.of(gsBin.toString(),
            "-q", "-dQUIET", "-dSAFER", "-dBATCH", "-dNOPAUSE", "-dNOPROMPT",
            "-dMaxBitMap=500000000", "-dAlignToPixels=0", "-dGridFitTT=2",
            "-sDEVICE=png16m", "-dTextAlphaBits=4", "-dGraphicsAlphaBits=4",
            "-r" + dpi,
            "-sOutputFile=" + outputDir.resolve(RasterService.pagePattern(baseName)),
            document.toString());
    }
}
