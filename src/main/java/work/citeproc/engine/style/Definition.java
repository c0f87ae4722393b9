package work.citeproc.engine.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code <citation>} or {@code <bibliography>} section: options, layouts and sort keys.
 */
public record Definition(Map<String, String> options, List<Layout> layouts, List<SortKeySpec> sortKeys) {
    public Definition {
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
        layouts = layouts == null ? List.of() : List.copyOf(layouts);
        sortKeys = sortKeys == null ? List.of() : List.copyOf(sortKeys);
    }

    public String option(String name) {
        return options.get(name);
    }

    public String option(String name, String fallback) {
        var value = options.get(name);
        return value == null ? fallback : value;
    }

    /**
     * Picks the CSL-M layout serving {@code language}, falling back to the untagged layout.
     */
    public Layout layoutFor(String language) {
        Layout fallback = null;
        for (var layout : layouts) {
            if (layout.serves(language)) {
                return layout;
            }
            if (layout.isDefault() && fallback == null) {
                fallback = layout;
            }
        }
        if (fallback != null) {
            return fallback;
        }
        return layouts.isEmpty() ? new Layout(List.of(), Map.of(), List.of()) : layouts.get(layouts.size() - 1);
    }
}
