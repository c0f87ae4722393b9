package work.citeproc.engine.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One {@code <layout>} of a citation or bibliography. CSL-M allows several, each tagged with the languages it serves.
 */
public record Layout(List<String> locales, Map<String, String> attributes, List<Node> children) {
    public Layout {
        locales = locales == null ? List.of() : List.copyOf(locales);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean isDefault() {
        return locales.isEmpty();
    }

    public String attr(String name, String fallback) {
        var value = attributes.get(name);
        return value == null ? fallback : value;
    }

    public boolean serves(String language) {
        if (language == null || language.isBlank()) {
            return false;
        }
        var lang = language.toLowerCase(Locale.ROOT);
        for (var tag : locales) {
            var normalized = tag.toLowerCase(Locale.ROOT);
            if (normalized.equals(lang) || lang.startsWith(normalized + "-") || normalized.startsWith(lang + "-")) {
                return true;
            }
        }
        return false;
    }
}
