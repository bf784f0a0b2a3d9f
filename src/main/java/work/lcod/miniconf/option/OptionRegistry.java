package work.lcod.miniconf.option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered collection of option declarations keyed by their long key.
 */
public final class OptionRegistry {
    public static final String HELP_KEY = "help";
    public static final String CONFIG_KEY = "config";
    static final String HELP_SHORTFLAG = "h";

    private final Map<String, OptionSpec> options = new LinkedHashMap<>();
    private String description = "";

    public OptionRegistry register(OptionSpec spec) {
        Objects.requireNonNull(spec, "spec");
        options.put(spec.key(), spec);
        return this;
    }

    public OptionRegistry withDescription(String description) {
        this.description = description == null ? "" : description;
        return this;
    }

    public String description() {
        return description;
    }

    public Optional<OptionSpec> option(String key) {
        return Optional.ofNullable(options.get(key));
    }

    public boolean contains(String key) {
        return options.containsKey(key);
    }

    /**
     * Linear scan; registries hold tens of options.
     */
    public Optional<OptionSpec> findByShortflag(String shortflag) {
        if (shortflag == null || shortflag.isEmpty()) {
            return Optional.empty();
        }
        for (OptionSpec spec : options.values()) {
            if (shortflag.equals(spec.shortflag())) {
                return Optional.of(spec);
            }
        }
        return Optional.empty();
    }

    public List<OptionSpec> options() {
        return Collections.unmodifiableList(new ArrayList<>(options.values()));
    }

    public int size() {
        return options.size();
    }

    public OptionRegistry copy() {
        var copy = new OptionRegistry().withDescription(description);
        copy.options.putAll(options);
        return copy;
    }

    /**
     * Adds the hidden {@code help} and {@code config} options unless the host already declared them.
     */
    public OptionRegistry withReservedOptions(boolean helpEnabled, boolean configEnabled) {
        if (helpEnabled && !contains(HELP_KEY)) {
            String shortflag = findByShortflag(HELP_SHORTFLAG).isPresent() ? "" : HELP_SHORTFLAG;
            register(OptionSpec.builder(HELP_KEY)
                .shortflag(shortflag)
                .description("Print usage and exit")
                .defaultValue(false)
                .hidden(true)
                .build());
        }
        if (configEnabled && !contains(CONFIG_KEY)) {
            register(OptionSpec.builder(CONFIG_KEY)
                .description("Configuration file to load before command-line values")
                .defaultValue("")
                .hidden(true)
                .build());
        }
        return this;
    }
}
