package work.lcod.miniconf.option;

import java.util.Objects;
import work.lcod.miniconf.api.DataType;
import work.lcod.miniconf.api.Value;

/**
 * Immutable declaration of one option. The tag of {@link #defaultValue()} is the declared type.
 */
public record OptionSpec(
    String key,
    String shortflag,
    String description,
    Value defaultValue,
    boolean required,
    boolean hidden
) {
    public OptionSpec {
        Objects.requireNonNull(key, "key");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Option key must not be blank");
        }
        shortflag = shortflag == null ? "" : shortflag;
        description = description == null ? "" : description;
        defaultValue = defaultValue == null ? Value.unknown() : defaultValue.copy();
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public DataType type() {
        return defaultValue.type();
    }

    /**
     * Returns a copy so callers cannot alter the declaration.
     */
    @Override
    public Value defaultValue() {
        return defaultValue.copy();
    }

    public boolean hasShortflag() {
        return !shortflag.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder(key)
            .shortflag(shortflag)
            .description(description)
            .defaultValue(defaultValue)
            .required(required)
            .hidden(hidden);
    }

    public static final class Builder {
        private final String key;
        private String shortflag = "";
        private String description = "";
        private Value defaultValue = Value.unknown();
        private boolean required;
        private boolean hidden;

        private Builder(String key) {
            this.key = key;
        }

        public Builder shortflag(String shortflag) {
            this.shortflag = shortflag;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder defaultValue(Value defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder defaultValue(int defaultValue) {
            return defaultValue(Value.of(defaultValue));
        }

        public Builder defaultValue(double defaultValue) {
            return defaultValue(Value.of(defaultValue));
        }

        public Builder defaultValue(boolean defaultValue) {
            return defaultValue(Value.of(defaultValue));
        }

        public Builder defaultValue(String defaultValue) {
            return defaultValue(Value.of(defaultValue));
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder hidden(boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        public OptionSpec build() {
            return new OptionSpec(key, shortflag, description, defaultValue, required, hidden);
        }
    }
}
