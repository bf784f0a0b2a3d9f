package work.lcod.miniconf.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.miniconf.runtime.Diagnostic;
import work.lcod.miniconf.runtime.ResolvedOptions;

/**
 * Outcome of one resolution: the resolved options, the diagnostics and the overall verdict.
 */
public record ResolutionResult(
    boolean success,
    ResolvedOptions options,
    List<Diagnostic> diagnostics,
    boolean helpRequested,
    Optional<LogLevel> worstSeverity,
    Optional<String> configFile
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ResolutionResult {
        Objects.requireNonNull(options, "options");
        diagnostics = List.copyOf(diagnostics);
        Objects.requireNonNull(worstSeverity, "worstSeverity");
        Objects.requireNonNull(configFile, "configFile");
    }

    public Value get(String key) {
        return options.get(key);
    }

    public int exitCode() {
        return success ? 0 : 1;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (var entry : options.values().entrySet()) {
            values.put(entry.getKey(), entry.getValue().toJavaObject());
        }
        List<Map<String, Object>> log = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("severity", diagnostic.severity().name().toLowerCase());
            item.put("subject", diagnostic.subject());
            item.put("message", diagnostic.message());
            log.add(item);
        }
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", success ? "success" : "failure");
        serializable.put("values", values);
        serializable.put("stray", options.strayKeys());
        serializable.put("diagnostics", log);
        configFile.ifPresent(path -> serializable.put("config", path));
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }
}
