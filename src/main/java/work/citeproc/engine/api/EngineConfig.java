package work.citeproc.engine.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.citeproc.engine.disambiguation.DisambiguationEngine;
import work.citeproc.engine.output.OutputFormat;
import work.citeproc.engine.runtime.RenderContext;

/**
 * Engine defaults read from a {@code citeproc.toml} file:
 *
 * <pre>
 * [locale]
 * default = "en-US"
 * [citations]
 * near-note-distance = 5
 * [output]
 * format = "text"
 * [engine]
 * memoize-macros = true
 * [disambiguation]
 * max-iterations = 10
 * </pre>
 */
public record EngineConfig(
    Optional<String> defaultLocale,
    int nearNoteDistance,
    OutputFormat outputFormat,
    boolean memoizeMacros,
    int maxIterations
) {
    public static final String FILE_NAME = "citeproc.toml";

    public static final EngineConfig DEFAULTS = new EngineConfig(
        Optional.empty(),
        RenderContext.DEFAULT_NEAR_NOTE_DISTANCE,
        OutputFormat.TEXT,
        true,
        DisambiguationEngine.DEFAULT_MAX_ITERATIONS
    );

    /**
     * @return the defaults when {@code path} is {@code null} or missing
     * @throws IllegalArgumentException when the file is not valid TOML
     */
    public static EngineConfig load(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            return DEFAULTS;
        }
        TomlParseResult result = Toml.parse(Files.readString(path));
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid " + path.getFileName() + ": " + result.errors().get(0).toString());
        }
        return fromToml(result);
    }

    public static EngineConfig fromToml(TomlParseResult toml) {
        var locale = Optional.ofNullable(toml.getString("locale.default")).filter(value -> !value.isBlank());
        var distance = toml.getLong("citations.near-note-distance");
        var format = toml.getString("output.format");
        var memoize = toml.getBoolean("engine.memoize-macros");
        var iterations = toml.getLong("disambiguation.max-iterations");
        return new EngineConfig(
            locale,
            distance == null ? DEFAULTS.nearNoteDistance() : Math.toIntExact(distance),
            format == null ? DEFAULTS.outputFormat() : OutputFormat.from(format),
            memoize == null ? DEFAULTS.memoizeMacros() : memoize,
            iterations == null ? DEFAULTS.maxIterations() : Math.toIntExact(iterations)
        );
    }
}
