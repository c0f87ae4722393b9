package work.citeproc.engine.locale;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Locale tables shipped as class-path resources under {@code /locales}.
 */
public final class BuiltinLocales {
    public static final String FALLBACK_LANGUAGE = "en-US";
    private static final Logger log = LogManager.getLogger(BuiltinLocales.class);
    private static final Map<String, String> PRIMARY_DIALECTS = Map.of(
        "en", "en-US",
        "de", "de-DE"
    );
    private static final Map<String, Optional<LocaleTable>> CACHE = new ConcurrentHashMap<>();

    private BuiltinLocales() {}

    public static Optional<LocaleTable> find(String language) {
        if (language == null || language.isBlank()) {
            return Optional.empty();
        }
        var tag = normalize(language);
        var exact = CACHE.computeIfAbsent(tag, BuiltinLocales::load);
        if (exact.isPresent()) {
            return exact;
        }
        var dialect = PRIMARY_DIALECTS.get(primary(tag));
        if (dialect != null && !dialect.equals(tag)) {
            return CACHE.computeIfAbsent(dialect, BuiltinLocales::load);
        }
        return Optional.empty();
    }

    /**
     * Tags of the bundled locale files.
     */
    public static List<String> shipped() {
        return PRIMARY_DIALECTS.values().stream().sorted().toList();
    }

    public static LocaleTable fallback() {
        return find(FALLBACK_LANGUAGE).orElseThrow(() -> new IllegalStateException("Missing built-in locale " + FALLBACK_LANGUAGE));
    }

    static String primary(String tag) {
        int dash = tag.indexOf('-');
        return dash < 0 ? tag : tag.substring(0, dash);
    }

    static String normalize(String language) {
        var parts = language.trim().replace('_', '-').split("-");
        if (parts.length == 1) {
            return parts[0].toLowerCase(Locale.ROOT);
        }
        return parts[0].toLowerCase(Locale.ROOT) + "-" + parts[1].toUpperCase(Locale.ROOT);
    }

    private static Optional<LocaleTable> load(String tag) {
        var resource = "/locales/locales-" + tag + ".xml";
        try (var in = BuiltinLocales.class.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            log.debug("Loading built-in locale {}", tag);
            return Optional.of(LocaleParser.parse(in));
        } catch (IOException ex) {
            log.warn("Unable to read built-in locale {}: {}", tag, ex.getMessage());
            return Optional.empty();
        }
    }
}
