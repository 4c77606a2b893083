package xyz.jphil.pdf_annotate.tools;

/**
 * Progress-aware logging that coordinates with the active stage progress bar.
 * Extends LogFormatter with minimal changes to prevent output interference.
 */
public class ProgressAwareLogFormatter extends LogFormatter {

    private volatile ProgressTracker progressTracker;

    public ProgressAwareLogFormatter(int verbosity, boolean includeTimestamp) {
        super(verbosity, includeTimestamp);
    }

    /**
     * Attach the tracker of the stage that is currently running, or null when no bar is shown.
     */
    public void attach(ProgressTracker tracker) {
        this.progressTracker = tracker;
    }

    public void detach() {
        this.progressTracker = null;
    }

    @Override
    public void info(String category, String message) {
        logWithCoordination(() -> super.info(category, message));
    }

    @Override
    public void success(String category, String message) {
        logWithCoordination(() -> super.success(category, message));
    }

    @Override
    public void warning(String category, String message) {
        logWithCoordination(() -> super.warning(category, message));
    }

    @Override
    public void error(String category, String message) {
        logWithCoordination(() -> super.error(category, message));
    }

    @Override
    public void debug(String category, String message) {
        if (!isDebugEnabled()) return;
        logWithCoordination(() -> super.debug(category, message));
    }

    @Override
    public void trace(String category, String message) {
        if (!isTraceEnabled()) return;
        logWithCoordination(() -> super.trace(category, message));
    }

    @Override
    public void step(String category, String message) {
        logWithCoordination(() -> super.step(category, message));
    }

    @Override
    public void complete(String category, String message) {
        logWithCoordination(() -> super.complete(category, message));
    }

    /**
     * Core coordination: clear progress → log → redraw progress
     */
    private void logWithCoordination(Runnable logAction) {
        var tracker = progressTracker;
        if (tracker != null) {
            synchronized (ProgressAwareLogFormatter.class) {
                tracker.clearLine();
                logAction.run();
                System.err.flush();
                tracker.forceRedraw();
            }
        } else {
            synchronized (ProgressAwareLogFormatter.class) {
                logAction.run();
            }
        }
    }

    public static ProgressAwareLogFormatter create(int verbosity) {
        return new ProgressAwareLogFormatter(verbosity, verbosity >= 2);
    }
}
