package xyz.jphil.pdf_annotate.tools.pipeline;

import lombok.Builder;

import java.nio.file.Path;

/**
 * Immutable settings of one run, resolved from the command line before any work starts.
 * A null {@code header}, {@code footer}, {@code labelSeparator} or {@code numberStart}
 * disables the corresponding stage.
 */
@Builder(toBuilder = true)
public record PipelineConfig(
    int dpi,
    PageLayout layout,
    Path header,
    Path footer,
    String labelSeparator,
    OverlaySpec label,
    Integer numberStart,
    String numberFormat,
    OverlaySpec number,
    int concurrency,
    Path output,
    boolean numberedOutput,
    boolean showProgress
) {

    public boolean mergeEnabled() {
        return header != null || footer != null;
    }

    public boolean labelEnabled() {
        return labelSeparator != null;
    }

    public boolean numberEnabled() {
        return numberStart != null;
    }
}
