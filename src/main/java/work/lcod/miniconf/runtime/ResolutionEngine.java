package work.lcod.miniconf.runtime;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.miniconf.api.DataType;
import work.lcod.miniconf.api.EngineSettings;
import work.lcod.miniconf.api.ResolutionResult;
import work.lcod.miniconf.api.Value;
import work.lcod.miniconf.document.DocumentException;
import work.lcod.miniconf.document.DocumentTree;
import work.lcod.miniconf.option.OptionRegistry;
import work.lcod.miniconf.option.OptionSpec;
import work.lcod.miniconf.parse.Token;
import work.lcod.miniconf.parse.TokenClassifier;
import work.lcod.miniconf.parse.TokenKind;
import work.lcod.miniconf.shared.ValueParser;

/**
 * Merges defaults, an optional configuration document and command-line tokens into a flat option
 * map, in that order of precedence.
 *
 * <p>Tokens exclude the program name. Expected problems (unknown flags, unparseable values,
 * missing required options) end up as diagnostics; nothing is thrown for them.
 */
public final class ResolutionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ResolutionEngine.class);

    private final OptionRegistry registry;
    private final EngineSettings settings;

    public ResolutionEngine(OptionRegistry declared, EngineSettings settings) {
        Objects.requireNonNull(declared, "declared");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.registry = declared.copy().withReservedOptions(settings.helpEnabled(), settings.configOptionEnabled());
    }

    /**
     * Registry as seen by the engine, reserved options included.
     */
    public OptionRegistry registry() {
        return registry;
    }

    public ResolutionResult resolve(List<String> args) {
        List<String> tokens = args == null ? List.of() : List.copyOf(args);
        var log = new DiagnosticLog(settings.logLevel());
        var resolved = new ResolvedOptions();

        log.appendAll(Validator.checkFormat(registry).diagnostics());
        if (log.shouldAbort()) {
            LOG.debug("Registry format errors, resolution aborted before reading tokens");
            return new ResolutionResult(false, resolved, log.entries(), false, log.worstSeverity(), Optional.empty());
        }

        for (OptionSpec spec : registry.options()) {
            Value defaultValue = spec.defaultValue();
            if (!defaultValue.isEmpty()) {
                resolved.put(spec.key(), defaultValue, true);
            }
        }

        List<Token> classified = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            classified.add(TokenClassifier.classify(token));
        }

        int consumed = -1;
        Optional<String> configFile = Optional.empty();
        if (settings.configOptionEnabled()) {
            configFile = findConfigFlagValue(classified);
            if (configFile.isEmpty() && classified.size() == 1 && classified.get(0).kind() == TokenKind.VALUE) {
                configFile = Optional.of(classified.get(0).raw());
                consumed = 0;
            }
            configFile.ifPresent(path -> mergeDocument(path, resolved, log));
        }

        scanTokens(classified, consumed, resolved, log);

        boolean helpRequested = false;
        if (settings.helpEnabled()) {
            Value help = resolved.get(OptionRegistry.HELP_KEY);
            if (help.type() == DataType.BOOL && help.getBoolean()) {
                helpRequested = true;
                LOG.debug("Help requested, rendering usage");
                settings.helpRenderer().render(registry);
            }
        }

        for (OptionSpec spec : registry.options()) {
            if (spec.hidden()) {
                resolved.remove(spec.key());
            }
        }

        log.appendAll(Validator.validate(registry, resolved).diagnostics());
        boolean success = !log.shouldAbort();
        LOG.debug("Resolved {} option(s), success={}", resolved.size(), success);
        return new ResolutionResult(success, resolved, log.entries(), helpRequested, log.worstSeverity(), configFile);
    }

    private Optional<String> findConfigFlagValue(List<Token> classified) {
        for (int i = 0; i + 1 < classified.size(); i++) {
            Token token = classified.get(i);
            if (!token.isFlag()) {
                continue;
            }
            boolean isConfigFlag = lookup(token)
                .map(spec -> OptionRegistry.CONFIG_KEY.equals(spec.key()))
                .orElse(false);
            Token next = classified.get(i + 1);
            if (isConfigFlag && next.kind() == TokenKind.VALUE) {
                return Optional.of(next.raw());
            }
        }
        return Optional.empty();
    }

    private void mergeDocument(String location, ResolvedOptions resolved, DiagnosticLog log) {
        DocumentTree tree;
        try {
            tree = settings.documentReader().read(Path.of(location));
        } catch (DocumentException | InvalidPathException ex) {
            log.error(location, "unable to load configuration document: " + ex.getMessage());
            return;
        }
        log.info(location, "loaded configuration document");
        for (String ignored : tree.ignoredPaths()) {
            log.warning(ignored, "arrays and null values are not supported, entry ignored");
        }
        for (var entry : tree.flatten().entrySet()) {
            String key = entry.getKey();
            Value scalar = entry.getValue();
            Optional<OptionSpec> option = registry.option(key);
            if (option.isEmpty()) {
                Optional<String> clash = strayClash(key, resolved);
                if (clash.isPresent()) {
                    log.warning(key, clash.get());
                    continue;
                }
                resolved.put(key, scalar, false);
                log.info(key, "not a declared option, kept as " + scalar.printType() + " " + scalar.print());
                continue;
            }
            OptionSpec spec = option.get();
            if (spec.hidden()) {
                log.warning(key, "reserved option cannot be set from a configuration document");
                continue;
            }
            Value coerced = ValueParser.coerce(scalar, spec.type());
            if (coerced.isEmpty()) {
                log.warning(key, "expected " + spec.type().label() + " but the document holds "
                    + scalar.printType() + " " + scalar.print() + ", keeping " + resolved.get(key).print());
                continue;
            }
            resolved.put(key, coerced, true);
            log.info(key, "set to " + coerced.print() + " from " + location);
        }
    }

    private void scanTokens(List<Token> classified, int consumed, ResolvedOptions resolved, DiagnosticLog log) {
        OptionSpec current = null;
        for (int i = 0; i < classified.size(); i++) {
            if (i == consumed) {
                continue;
            }
            Token token = classified.get(i);
            switch (token.kind()) {
                case LONG_FLAG, SHORT_FLAG -> current = applyFlag(token, resolved, log);
                case VALUE -> {
                    if (current == null) {
                        log.warning(token.raw(), "value does not follow an option, ignored");
                    } else {
                        applyValue(current, token, resolved, log);
                        current = null;
                    }
                }
                case UNKNOWN -> log.error(token.raw(), "unrecognized token");
            }
        }
    }

    private OptionSpec applyFlag(Token token, ResolvedOptions resolved, DiagnosticLog log) {
        Optional<OptionSpec> option = lookup(token);
        if (option.isEmpty()) {
            if (token.kind() == TokenKind.LONG_FLAG && !token.key().isEmpty()) {
                log.warning(token.raw(), "unknown option, a following value is kept as text");
                return wildcard(token.key());
            }
            log.warning(token.raw(), "unknown flag");
            return null;
        }
        OptionSpec spec = option.get();
        if (spec.type() == DataType.BOOL) {
            resolved.put(spec.key(), Value.of(true), true);
            log.info(spec.key(), "set to true by " + token.raw());
        }
        return spec;
    }

    private void applyValue(OptionSpec option, Token token, ResolvedOptions resolved, DiagnosticLog log) {
        Value parsed = ValueParser.parse(token.raw(), option.type());
        if (parsed.isEmpty()) {
            log.warning(option.key(), "cannot read '" + token.raw() + "' as " + option.type().label()
                + ", keeping " + resolved.get(option.key()).print());
            return;
        }
        boolean declared = registry.contains(option.key());
        if (!declared) {
            Optional<String> clash = strayClash(option.key(), resolved);
            if (clash.isPresent()) {
                log.warning(option.key(), clash.get());
                return;
            }
        }
        resolved.put(option.key(), parsed, declared);
        log.info(option.key(), "set to " + parsed.print());
    }

    private Optional<OptionSpec> lookup(Token token) {
        if (token.kind() == TokenKind.LONG_FLAG) {
            return registry.option(token.key());
        }
        if (token.kind() == TokenKind.SHORT_FLAG) {
            return registry.findByShortflag(token.key());
        }
        return Optional.empty();
    }

    /**
     * Reason an undeclared key cannot join the resolved options, if any: it is not a dot path, or
     * it nests below (or above) a declared option or an earlier entry.
     */
    private Optional<String> strayClash(String key, ResolvedOptions resolved) {
        if (!DocumentTree.isPath(key)) {
            return Optional.of("not a valid dot path, entry ignored");
        }
        for (OptionSpec spec : registry.options()) {
            if (DocumentTree.overlaps(key, spec.key())) {
                return Optional.of("clashes with option " + spec.key() + ", entry ignored");
            }
        }
        for (String other : resolved.keys()) {
            if (DocumentTree.overlaps(key, other)) {
                return Optional.of("clashes with " + other + ", entry ignored");
            }
        }
        return Optional.empty();
    }

    private static OptionSpec wildcard(String key) {
        return OptionSpec.builder(key).defaultValue("").build();
    }
}
