package work.citeproc.engine.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.citeproc.engine.output.OutputFormat;

/**
 * Immutable configuration passed to {@link CiteprocRunner}. Explicit settings win over {@link EngineConfig}
 * values, which win over the style's own defaults.
 */
public record RenderConfiguration(
    Path style,
    Path bibliography,
    Optional<Path> citations,
    List<Path> localeFiles,
    Optional<String> locale,
    Optional<OutputFormat> format,
    EngineConfig engineConfig,
    boolean strict,
    LogLevel logLevel
) {
    public RenderConfiguration {
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(bibliography, "bibliography");
        Objects.requireNonNull(citations, "citations");
        localeFiles = localeFiles == null ? List.of() : List.copyOf(localeFiles);
        Objects.requireNonNull(locale, "locale");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(engineConfig, "engineConfig");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public OutputFormat effectiveFormat() {
        return format.orElse(engineConfig.outputFormat());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path style;
        private Path bibliography;
        private Optional<Path> citations = Optional.empty();
        private List<Path> localeFiles = List.of();
        private Optional<String> locale = Optional.empty();
        private Optional<OutputFormat> format = Optional.empty();
        private EngineConfig engineConfig = EngineConfig.DEFAULTS;
        private boolean strict;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder style(Path style) {
            this.style = style;
            return this;
        }

        public Builder bibliography(Path bibliography) {
            this.bibliography = bibliography;
            return this;
        }

        public Builder citations(Optional<Path> citations) {
            this.citations = citations;
            return this;
        }

        public Builder localeFiles(List<Path> localeFiles) {
            this.localeFiles = localeFiles;
            return this;
        }

        public Builder locale(Optional<String> locale) {
            this.locale = locale;
            return this;
        }

        public Builder format(Optional<OutputFormat> format) {
            this.format = format;
            return this;
        }

        public Builder engineConfig(EngineConfig engineConfig) {
            this.engineConfig = engineConfig;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RenderConfiguration build() {
            return new RenderConfiguration(
                style,
                bibliography,
                citations,
                localeFiles,
                locale,
                format,
                engineConfig,
                strict,
                logLevel
            );
        }
    }
}
