package xyz.jphil.pdf_annotate.tools;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-stage progress bar on stderr. Counts completed work items of one stage.
 * When {@code showProgress} is off the tracker only counts and prints nothing.
 */
@Getter
@Accessors(fluent = true)
public class ProgressTracker implements AutoCloseable {
    private final String task;
    private final int total;
    private final boolean showProgress;
    private final Instant startedAt = Instant.now();
    private final Terminal terminal;

    private final AtomicInteger completed = new AtomicInteger(0);
    private volatile boolean closed;

    public record Stats(double pct, Duration elapsed, String eta) {}

    public ProgressTracker(String task, int total, boolean showProgress) {
        this.task = task;
        this.total = total;
        this.showProgress = showProgress;
        this.terminal = showProgress ? openTerminal() : null;
    }

    /**
     * Tracker that never draws, used when progress bars are disabled.
     */
    public static ProgressTracker silent(String task, int total) {
        return new ProgressTracker(task, total, false);
    }

    private static Terminal openTerminal() {
        try {
            return TerminalBuilder.builder().system(true).dumb(true).build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize terminal", e);
        }
    }

    public ProgressTracker start() {
        show();
        return this;
    }

    public ProgressTracker inc() {
        completed.incrementAndGet();
        show();
        return this;
    }

    public ProgressTracker done() {
        completed.set(total);
        if (showProgress) {
            clearLine();
            var elapsed = Duration.between(startedAt, Instant.now());
            System.err.printf("✓ %s completed (%d items) in %s%n", task, total, fmt(elapsed));
        }
        close();
        return this;
    }

    public void clearLine() {
        if (!showProgress || total == 0) return;
        int termWidth = getEffectiveTerminalWidth();
        System.err.printf("\r%s\r", " ".repeat(termWidth - 1));
        System.err.flush();
    }

    public void forceRedraw() {
        show();
    }

    private synchronized void show() {
        if (total == 0 || !showProgress) return;

        var stats = calcStats();
        int currentCompleted = completed.get();
        int termWidth = getEffectiveTerminalWidth();
        if (termWidth > 50) {
            var bar = bar(stats.pct(), Math.min(25, termWidth - 50));
            System.err.printf("\r%s %5.1f%% (%d/%d) %s %s",
                bar, stats.pct(), currentCompleted, total, task, stats.eta());
        } else if (currentCompleted % Math.max(1, total / 10) == 0 || currentCompleted == total) {
            // narrow terminals: plain text progress
            System.err.printf("  %s: %d/%d (%.1f%%)%n", task, currentCompleted, total, stats.pct());
        }
        System.err.flush();
    }

    private int getEffectiveTerminalWidth() {
        if (terminal == null) return 80;
        try {
            int jlineWidth = terminal.getWidth();
            // JLine reports tiny widths for dumb terminals
            return jlineWidth > 20 ? jlineWidth : 80;
        } catch (RuntimeException e) {
            return 80;
        }
    }

    /**
     * Releases the terminal. Safe to call more than once, and after {@link #done()}.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (terminal == null) return;
        try {
            terminal.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close terminal", e);
        }
    }

    Stats calcStats() {
        int currentCompleted = completed.get();
        var pct = total == 0 ? 100.0 : (double) currentCompleted / total * 100;
        var elapsed = Duration.between(startedAt, Instant.now());
        return new Stats(pct, elapsed, eta(elapsed, currentCompleted));
    }

    private String bar(double pct, int width) {
        var filled = (int) (pct / 100 * width);
        var sb = new StringBuilder("[");
        for (int i = 0; i < width; i++) {
            sb.append(i < filled ? "█" : "░");
        }
        return sb.append("]").toString();
    }

    private String eta(Duration elapsed, int currentCompleted) {
        if (currentCompleted == 0) return "ETA: --:--";

        var avgMillis = elapsed.toMillis() / currentCompleted;
        var etaMillis = (total - currentCompleted) * avgMillis;
        return "ETA: " + fmt(Duration.ofMillis(etaMillis));
    }

    private String fmt(Duration d) {
        var h = d.toHours();
        var m = d.toMinutesPart();
        var s = d.toSecondsPart();

        return h > 0 ? "%dh %02dm".formatted(h, m) :
               m > 0 ? "%dm %02ds".formatted(m, s) :
                       "%ds".formatted(s);
    }
}
