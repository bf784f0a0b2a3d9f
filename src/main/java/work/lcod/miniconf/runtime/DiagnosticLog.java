package work.lcod.miniconf.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.miniconf.api.LogLevel;

/**
 * Append-only diagnostic log of one resolution.
 *
 * <p>Entries below the threshold are dropped when appended, but still count towards the worst
 * severity seen. Kept entries are mirrored to SLF4J.
 */
public final class DiagnosticLog {
    private static final Logger LOG = LoggerFactory.getLogger("work.lcod.miniconf.diagnostics");

    private final LogLevel threshold;
    private final List<Diagnostic> entries = new ArrayList<>();
    private LogLevel worst;

    public DiagnosticLog(LogLevel threshold) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
    }

    public LogLevel threshold() {
        return threshold;
    }

    public void append(Diagnostic diagnostic) {
        Objects.requireNonNull(diagnostic, "diagnostic");
        if (worst == null || diagnostic.severity().atLeast(worst)) {
            worst = diagnostic.severity();
        }
        if (threshold == LogLevel.SILENT || !diagnostic.severity().atLeast(threshold)) {
            return;
        }
        entries.add(diagnostic);
        mirror(diagnostic);
    }

    public void appendAll(List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            append(diagnostic);
        }
    }

    public void info(String subject, String message) {
        append(Diagnostic.info(subject, message));
    }

    public void warning(String subject, String message) {
        append(Diagnostic.warning(subject, message));
    }

    public void error(String subject, String message) {
        append(Diagnostic.error(subject, message));
    }

    public List<Diagnostic> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public Optional<LogLevel> worstSeverity() {
        return Optional.ofNullable(worst);
    }

    /**
     * True once an error was seen, unless the threshold is {@link LogLevel#SILENT}.
     */
    public boolean shouldAbort() {
        return threshold != LogLevel.SILENT && worst != null && worst.atLeast(LogLevel.ERROR);
    }

    private static void mirror(Diagnostic diagnostic) {
        switch (diagnostic.severity()) {
            case ERROR -> LOG.error("{}: {}", diagnostic.subject(), diagnostic.message());
            case WARNING -> LOG.warn("{}: {}", diagnostic.subject(), diagnostic.message());
            default -> LOG.info("{}: {}", diagnostic.subject(), diagnostic.message());
        }
    }
}
