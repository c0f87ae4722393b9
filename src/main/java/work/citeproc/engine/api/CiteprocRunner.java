package work.citeproc.engine.api;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.citeproc.engine.data.CitationLoader;
import work.citeproc.engine.data.CitationOccurrence;
import work.citeproc.engine.data.EntryLoader;
import work.citeproc.engine.disambiguation.DisambiguationOutcome;
import work.citeproc.engine.locale.LocaleParser;
import work.citeproc.engine.locale.LocaleResolver;
import work.citeproc.engine.locale.LocaleTable;
import work.citeproc.engine.style.Style;
import work.citeproc.engine.style.StyleException;
import work.citeproc.engine.style.StyleMetrics;
import work.citeproc.engine.style.StyleParser;

/**
 * Public entry point: loads the style, bibliography, citations and locales named by a
 * {@link RenderConfiguration} and renders them. Failures are reported in the result, never thrown.
 */
public final class CiteprocRunner {
    private static final Logger log = LogManager.getLogger(CiteprocRunner.class);

    public RenderResult run(RenderConfiguration configuration) {
        var started = Instant.now();
        try {
            var style = loadStyle(configuration);
            var entries = EntryLoader.load(configuration.bibliography());
            List<CitationOccurrence> citations = configuration.citations().map(CitationLoader::load).orElse(List.of());
            var supplied = new ArrayList<LocaleTable>();
            for (var path : configuration.localeFiles()) {
                supplied.add(LocaleParser.parse(path));
            }
            var engineConfig = configuration.engineConfig();
            var language = configuration.locale()
                .or(engineConfig::defaultLocale)
                .orElse(style.defaultLocale());
            var locale = LocaleResolver.of(language, style.locales(), supplied);
            var format = configuration.effectiveFormat();
            var session = EngineSession.builder(style)
                .entries(entries)
                .locale(locale)
                .format(format)
                .memoizeMacros(engineConfig.memoizeMacros())
                .nearNoteDistance(engineConfig.nearNoteDistance())
                .maxIterations(engineConfig.maxIterations())
                .build();
            session.citeAll(citations);
            var result = session.render();
            log.info("Rendered {} citations and {} bibliography entries with style '{}'",
                result.citations().size(), result.bibliography().size(), style.id());

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("style", styleInfo(style));
            metadata.put("locale", locale.language());
            metadata.put("format", format.name().toLowerCase(Locale.ROOT));
            metadata.put("citations", citations(result));
            metadata.put("bibliography", bibliography(result));
            metadata.put("bibliographyFormat", bibliographyFormat(result.bibliographyFormat()));
            metadata.put("disambiguation", disambiguation(result.disambiguation()));
            metadata.put("warnings", result.warnings());
            return RenderResult.success(metadata, started);
        } catch (StyleException ex) {
            var meta = new LinkedHashMap<String, Object>();
            meta.put("code", ex.code());
            meta.put("style", configuration.style().toString());
            return RenderResult.failure(ex.getMessage(), meta, started);
        } catch (Exception ex) {
            var meta = new LinkedHashMap<String, Object>();
            meta.put("style", configuration.style().toString());
            if (Boolean.getBoolean("citeproc.debug")) {
                log.error("Rendering failed", ex);
            }
            return RenderResult.failure(ex.getMessage(), meta, started);
        }
    }

    private static Style loadStyle(RenderConfiguration configuration) throws IOException {
        try (var in = Files.newInputStream(configuration.style())) {
            return StyleParser.parse(in, configuration.strict());
        }
    }

    private static Map<String, Object> styleInfo(Style style) {
        var info = new LinkedHashMap<String, Object>();
        info.put("id", style.id());
        info.put("title", style.title());
        info.put("class", style.styleClass().name().toLowerCase(Locale.ROOT));
        info.put("metrics", StyleMetrics.analyze(style).toMap());
        return info;
    }

    private static List<Map<String, Object>> citations(SessionResult result) {
        var list = new ArrayList<Map<String, Object>>();
        for (var citation : result.citations()) {
            var map = new LinkedHashMap<String, Object>();
            map.put("id", citation.citationId());
            map.put("text", citation.text());
            if (citation.noteNumber() != null) {
                map.put("noteNumber", citation.noteNumber());
            }
            map.put("items", citation.itemIds());
            list.add(map);
        }
        return list;
    }

    private static List<Map<String, Object>> bibliography(SessionResult result) {
        var list = new ArrayList<Map<String, Object>>();
        for (var item : result.bibliography()) {
            var map = new LinkedHashMap<String, Object>();
            map.put("id", item.id());
            map.put("citationNumber", item.citationNumber());
            map.put("text", item.text());
            map.put("textWithoutNumber", item.textWithoutNumber());
            list.add(map);
        }
        return list;
    }

    private static Map<String, Object> bibliographyFormat(BibliographyFormat format) {
        var map = new LinkedHashMap<String, Object>();
        map.put("hangingIndent", format.hangingIndent());
        if (format.secondFieldAlign() != null) {
            map.put("secondFieldAlign", format.secondFieldAlign());
        }
        map.put("lineSpacing", format.lineSpacing());
        map.put("entrySpacing", format.entrySpacing());
        return map;
    }

    private static Map<String, Object> disambiguation(DisambiguationOutcome outcome) {
        var map = new LinkedHashMap<String, Object>();
        map.put("converged", outcome.converged());
        if (outcome instanceof DisambiguationOutcome.Converged converged) {
            map.put("iterations", converged.iterations());
        } else if (outcome instanceof DisambiguationOutcome.CappedAt capped) {
            map.put("cap", capped.cap());
        }
        return map;
    }
}
