package work.lcod.miniconf.api;

import java.util.Locale;

/**
 * Diagnostic severities, ordered. As a threshold, {@link #SILENT} drops every entry and
 * disables abort-on-error.
 */
public enum LogLevel {
    INFO,
    WARNING,
    ERROR,
    SILENT;

    public boolean atLeast(LogLevel other) {
        return compareTo(other) >= 0;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARNING;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}
