package work.lcod.miniconf.runtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.miniconf.api.LogLevel;
import work.lcod.miniconf.document.DocumentTree;
import work.lcod.miniconf.option.OptionRegistry;
import work.lcod.miniconf.option.OptionSpec;

/**
 * Registry format checks (before any token is read) and post-resolution validation.
 */
public final class Validator {
    private Validator() {}

    public static Findings checkFormat(OptionRegistry registry) {
        List<Diagnostic> found = new ArrayList<>();
        Map<String, String> shortflagOwners = new LinkedHashMap<>();
        Set<String> reportedOwners = new HashSet<>();
        List<String> keys = new ArrayList<>();
        for (OptionSpec spec : registry.options()) {
            if (!DocumentTree.isPath(spec.key())) {
                found.add(Diagnostic.error(spec.key(), "key is not a valid dot path"));
            }
            for (String earlier : keys) {
                if (DocumentTree.overlaps(spec.key(), earlier)) {
                    found.add(Diagnostic.error(spec.key(), "key clashes with option " + earlier));
                }
            }
            keys.add(spec.key());
            if (!spec.required() && spec.defaultValue().isEmpty()) {
                found.add(Diagnostic.error(spec.key(), "optional option needs a default value"));
            }
            if (spec.hasShortflag()) {
                String owner = shortflagOwners.putIfAbsent(spec.shortflag(), spec.key());
                if (owner != null) {
                    if (reportedOwners.add(owner)) {
                        found.add(Diagnostic.error(owner,
                            "shortflag -" + spec.shortflag() + " is also used by " + spec.key()));
                    }
                    found.add(Diagnostic.error(spec.key(),
                        "shortflag -" + spec.shortflag() + " is already used by " + owner));
                }
            }
            if (spec.hidden()) {
                continue;
            }
            if (spec.description().isBlank()) {
                found.add(Diagnostic.warning(spec.key(), "no description"));
            }
            if (!spec.hasShortflag()) {
                found.add(Diagnostic.warning(spec.key(), "no shortflag"));
            }
        }
        return new Findings(found);
    }

    public static Findings validate(OptionRegistry registry, ResolvedOptions resolved) {
        List<Diagnostic> found = new ArrayList<>();
        for (String key : resolved.keys()) {
            if (resolved.get(key).isEmpty()) {
                found.add(Diagnostic.error(key, "resolved value is empty"));
            }
        }
        for (OptionSpec spec : registry.options()) {
            if (!spec.hidden() && !resolved.contains(spec.key())) {
                found.add(Diagnostic.error(spec.key(), "required option was not given a value"));
            }
        }
        return new Findings(found);
    }

    /**
     * Diagnostics of one check, in discovery order.
     */
    public record Findings(List<Diagnostic> diagnostics) {
        public Findings {
            diagnostics = List.copyOf(diagnostics);
        }

        public Optional<LogLevel> worstSeverity() {
            LogLevel worst = null;
            for (Diagnostic diagnostic : diagnostics) {
                if (worst == null || diagnostic.severity().atLeast(worst)) {
                    worst = diagnostic.severity();
                }
            }
            return Optional.ofNullable(worst);
        }

        public boolean hasErrors() {
            return worstSeverity().filter(level -> level.atLeast(LogLevel.ERROR)).isPresent();
        }
    }
}
