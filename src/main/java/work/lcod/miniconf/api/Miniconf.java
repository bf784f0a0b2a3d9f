package work.lcod.miniconf.api;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.miniconf.document.DocumentFormat;
import work.lcod.miniconf.document.DocumentFormats;
import work.lcod.miniconf.option.OptionRegistry;
import work.lcod.miniconf.option.OptionSpec;
import work.lcod.miniconf.runtime.ResolutionEngine;

/**
 * Public entry point for host applications: declare options, resolve arguments, read the values.
 *
 * <pre>{@code
 * var conf = new Miniconf().description("demo");
 * conf.declare(OptionSpec.builder("numOpt").shortflag("n").defaultValue(3.14).description("A number").build());
 * ResolutionResult result = conf.resolve(args);
 * double n = result.get("numOpt").getNumber();
 * }</pre>
 */
public final class Miniconf {
    private final OptionRegistry registry = new OptionRegistry();
    private EngineSettings settings;
    private ResolutionResult lastResult;

    public Miniconf() {
        this(EngineSettings.defaults());
    }

    public Miniconf(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public Miniconf description(String description) {
        registry.withDescription(description);
        return this;
    }

    /**
     * Declares an option; declaring an existing key again replaces the earlier declaration.
     */
    public Miniconf declare(OptionSpec spec) {
        registry.register(spec);
        return this;
    }

    public Optional<OptionSpec> option(String key) {
        return registry.option(key);
    }

    public Miniconf settings(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        return this;
    }

    public Miniconf logLevel(LogLevel logLevel) {
        return settings(settings.toBuilder().logLevel(logLevel).build());
    }

    public EngineSettings settings() {
        return settings;
    }

    public OptionRegistry registry() {
        return registry;
    }

    public ResolutionResult resolve(String... args) {
        return resolve(args == null ? List.of() : Arrays.asList(args));
    }

    public ResolutionResult resolve(List<String> args) {
        lastResult = new ResolutionEngine(registry, settings).resolve(args);
        return lastResult;
    }

    public Optional<ResolutionResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    /**
     * Value from the last resolution; empty when nothing was resolved yet or the key is unknown.
     */
    public Value get(String key) {
        return lastResult == null ? Value.unknown() : lastResult.get(key);
    }

    public void serialize(Path path) {
        serialize(path, DocumentFormats.forPath(path));
    }

    public void serialize(Path path, DocumentFormat format) {
        if (lastResult == null) {
            throw new IllegalStateException("Nothing resolved yet");
        }
        DocumentFormats.write(path, lastResult.options().toDocument(), format);
    }

    /**
     * Reads a document into flat dot-path keys without touching the registry.
     */
    public static Map<String, Value> load(Path path) {
        return DocumentFormats.read(path).flatten();
    }
}
