package work.lcod.miniconf.runtime;

import java.util.Objects;
import work.lcod.miniconf.api.LogLevel;

/**
 * One diagnostic record: a severity, the token or key it is about, and a message.
 */
public record Diagnostic(LogLevel severity, String subject, String message) {
    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        if (severity == LogLevel.SILENT) {
            throw new IllegalArgumentException("SILENT is a threshold, not a severity");
        }
        subject = subject == null ? "" : subject;
        message = message == null ? "" : message;
    }

    public static Diagnostic info(String subject, String message) {
        return new Diagnostic(LogLevel.INFO, subject, message);
    }

    public static Diagnostic warning(String subject, String message) {
        return new Diagnostic(LogLevel.WARNING, subject, message);
    }

    public static Diagnostic error(String subject, String message) {
        return new Diagnostic(LogLevel.ERROR, subject, message);
    }

    @Override
    public String toString() {
        return "[" + severity.name() + "] " + subject + ": " + message;
    }
}
