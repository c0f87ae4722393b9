package work.citeproc.engine.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized bibliography record keyed by CSL variable names. Owned by the caller and never mutated by the engine.
 */
public record Entry(String id, String type, Map<String, String> fields, Map<String, List<Name>> names) {
    public Entry {
        Objects.requireNonNull(id, "id");
        type = type == null || type.isBlank() ? "document" : type;
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        var nameCopy = new LinkedHashMap<String, List<Name>>();
        if (names != null) {
            names.forEach((role, list) -> nameCopy.put(role, List.copyOf(list)));
        }
        names = Collections.unmodifiableMap(nameCopy);
    }

    public String field(String name) {
        return fields.get(name);
    }

    public List<Name> names(String role) {
        return names.getOrDefault(role, List.of());
    }

    public String language() {
        return fields.get("language");
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String type = "document";
        private final Map<String, String> fields = new LinkedHashMap<>();
        private final Map<String, List<Name>> names = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder field(String name, String value) {
            if (value != null) {
                fields.put(name, value);
            }
            return this;
        }

        public Builder names(String role, List<Name> list) {
            names.put(role, list);
            return this;
        }

        public Builder name(String role, Name name) {
            names.computeIfAbsent(role, key -> new ArrayList<>()).add(name);
            return this;
        }

        public Entry build() {
            return new Entry(id, type, fields, names);
        }
    }
}
