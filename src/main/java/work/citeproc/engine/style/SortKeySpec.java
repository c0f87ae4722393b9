package work.citeproc.engine.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@code <key>} of a {@code <sort>} block: either a variable or a macro, optionally descending.
 */
public record SortKeySpec(String variable, String macro, boolean descending, Map<String, String> attributes) {
    public SortKeySpec {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean isMacro() {
        return macro != null && !macro.isBlank();
    }

    public Integer intAttr(String name) {
        var value = attributes.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
