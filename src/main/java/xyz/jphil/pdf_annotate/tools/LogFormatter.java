package xyz.jphil.pdf_annotate.tools;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Standardized logging formatter for consistent output across all pipeline stages.
 * Verbosity 0 shows progress lines and errors, 1 adds debug details, 2 adds trace output.
 */
public class LogFormatter {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final int verbosity;
    private final boolean includeTimestamp;

    public LogFormatter(int verbosity, boolean includeTimestamp) {
        this.verbosity = verbosity;
        this.includeTimestamp = includeTimestamp;
    }

    public LogFormatter(int verbosity) {
        this(verbosity, false);
    }

    public boolean isDebugEnabled() {
        return verbosity >= 1;
    }

    public boolean isTraceEnabled() {
        return verbosity >= 2;
    }

    /**
     * Log info message with consistent formatting
     */
    public void info(String category, String message) {
        System.err.printf("%s%s %s%n", timestamp(), category(category), message);
    }

    public void success(String category, String message) {
        System.err.printf("%s✅ %s %s%n", timestamp(), category(category), message);
    }

    public void warning(String category, String message) {
        System.err.printf("%s⚠️ %s %s%n", timestamp(), category(category), message);
    }

    /**
     * Log error message (always shown regardless of verbosity)
     */
    public void error(String category, String message) {
        System.err.printf("%s❌ %s %s%n", timestamp(), category(category), message);
    }

    /**
     * Log debug details (-v)
     */
    public void debug(String category, String message) {
        if (!isDebugEnabled()) return;
        System.err.printf("%s🔍 %s %s%n", timestamp(), category(category), message);
    }

    /**
     * Log trace details (-vv), e.g. natural sort keys
     */
    public void trace(String category, String message) {
        if (!isTraceEnabled()) return;
        System.err.printf("%s· %s %s%n", timestamp(), category(category), message);
    }

    /**
     * Log step/progress information
     */
    public void step(String category, String message) {
        System.err.printf("%s▶️ %s %s%n", timestamp(), category(category), message);
    }

    public void complete(String category, String message) {
        System.err.printf("%s🏁 %s %s%n", timestamp(), category(category), message);
    }

    private String timestamp() {
        if (!includeTimestamp) return "";
        return "[" + LocalDateTime.now().format(TIME_FORMAT) + "] ";
    }

    private String category(String cat) {
        return "[" + cat + "]";
    }
}
