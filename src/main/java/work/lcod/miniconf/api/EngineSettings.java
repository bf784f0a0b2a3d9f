package work.lcod.miniconf.api;

import java.util.Objects;
import work.lcod.miniconf.document.DocumentFormats;
import work.lcod.miniconf.document.DocumentReader;
import work.lcod.miniconf.runtime.HelpRenderer;

/**
 * Immutable settings of the resolution engine.
 */
public record EngineSettings(
    LogLevel logLevel,
    boolean helpEnabled,
    boolean configOptionEnabled,
    HelpRenderer helpRenderer,
    DocumentReader documentReader
) {
    public EngineSettings {
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(helpRenderer, "helpRenderer");
        Objects.requireNonNull(documentReader, "documentReader");
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .logLevel(logLevel)
            .helpEnabled(helpEnabled)
            .configOptionEnabled(configOptionEnabled)
            .helpRenderer(helpRenderer)
            .documentReader(documentReader);
    }

    public static final class Builder {
        private LogLevel logLevel = LogLevel.WARNING;
        private boolean helpEnabled = true;
        private boolean configOptionEnabled = true;
        private HelpRenderer helpRenderer = HelpRenderer.NONE;
        private DocumentReader documentReader = DocumentFormats::read;

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder helpEnabled(boolean helpEnabled) {
            this.helpEnabled = helpEnabled;
            return this;
        }

        public Builder configOptionEnabled(boolean configOptionEnabled) {
            this.configOptionEnabled = configOptionEnabled;
            return this;
        }

        public Builder helpRenderer(HelpRenderer helpRenderer) {
            this.helpRenderer = helpRenderer;
            return this;
        }

        public Builder documentReader(DocumentReader documentReader) {
            this.documentReader = documentReader;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(logLevel, helpEnabled, configOptionEnabled, helpRenderer, documentReader);
        }
    }
}
