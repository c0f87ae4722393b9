package work.citeproc.engine.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads CSL-JSON (or the same structure written as YAML) into {@link Entry} records.
 */
public final class EntryLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private EntryLoader() {}

    public static List<Entry> load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return load(in, isYaml(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read bibliography: " + path, ex);
        }
    }

    public static List<Entry> load(InputStream in, boolean yaml) throws IOException {
        var root = (yaml ? YAML_MAPPER : JSON_MAPPER).readTree(in);
        return fromTree(root);
    }

    public static List<Entry> fromJson(String json) throws IOException {
        return fromTree(JSON_MAPPER.readTree(json));
    }

    static boolean isYaml(Path path) {
        var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    static List<Entry> fromTree(JsonNode root) throws IOException {
        if (root == null || root.isNull()) {
            return List.of();
        }
        JsonNode items = root;
        if (root.isObject()) {
            items = root.has("items") ? root.get("items") : root.get("references");
        }
        if (items == null || !items.isArray()) {
            throw new IOException("Bibliography must be an array of CSL-JSON items");
        }
        var entries = new ArrayList<Entry>();
        int index = 0;
        for (var item : items) {
            index++;
            entries.add(toEntry(item, index));
        }
        return entries;
    }

    private static Entry toEntry(JsonNode item, int index) throws IOException {
        if (!item.isObject()) {
            throw new IOException("Bibliography item must be an object: " + item);
        }
        var id = item.hasNonNull("id") ? item.get("id").asText() : "ITEM-" + index;
        var builder = Entry.builder(id);
        var fields = item.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            if ("id".equals(key) || value == null || value.isNull()) {
                continue;
            }
            if ("type".equals(key)) {
                builder.type(value.asText());
            } else if (Variables.isName(key) || isNameArray(value)) {
                builder.names(key, toNames(value));
            } else if (Variables.isDate(key) && value.isObject()) {
                builder.field(key, toDateString(value));
            } else if (value.isValueNode()) {
                builder.field(key, value.asText());
            } else if (value.isArray() && value.size() > 0 && value.get(0).isValueNode()) {
                var joined = new ArrayList<String>();
                value.forEach(element -> joined.add(element.asText()));
                builder.field(key, String.join(", ", joined));
            }
        }
        return builder.build();
    }

    private static boolean isNameArray(JsonNode value) {
        if (!value.isArray() || value.isEmpty()) {
            return false;
        }
        var first = value.get(0);
        return first.isObject() && (first.has("family") || first.has("literal") || first.has("given"));
    }

    private static List<Name> toNames(JsonNode value) {
        var names = new ArrayList<Name>();
        if (!value.isArray()) {
            if (value.isTextual()) {
                names.add(Name.literal(value.asText()));
            }
            return names;
        }
        for (var node : value) {
            if (node.isTextual()) {
                names.add(Name.literal(node.asText()));
                continue;
            }
            names.add(new Name(
                text(node, "family"),
                text(node, "given"),
                text(node, "non-dropping-particle"),
                text(node, "dropping-particle"),
                text(node, "suffix"),
                text(node, "literal")
            ));
        }
        return names;
    }

    /**
     * Flattens a CSL-JSON date object to the {@code YYYY-MM-DD[/YYYY-MM-DD]} form the date parser reads.
     * Seasons become months 21-24; {@code circa} becomes a leading {@code ~}.
     */
    static String toDateString(JsonNode date) {
        if (date.hasNonNull("literal")) {
            return date.get("literal").asText();
        }
        var parts = date.get("date-parts");
        if (parts == null || !parts.isArray() || parts.isEmpty()) {
            return date.hasNonNull("raw") ? date.get("raw").asText() : "";
        }
        var ranges = new ArrayList<String>();
        for (var part : parts) {
            if (!part.isArray() || part.isEmpty()) {
                continue;
            }
            var segments = new ArrayList<String>();
            for (int i = 0; i < part.size() && i < 3; i++) {
                var raw = part.get(i).asText().trim();
                if (raw.isEmpty()) {
                    break;
                }
                segments.add(i == 0 ? raw : pad(raw));
            }
            if (!segments.isEmpty()) {
                ranges.add(String.join("-", segments));
            }
        }
        if (ranges.isEmpty()) {
            return "";
        }
        var result = String.join("/", ranges);
        if (date.hasNonNull("season") && !result.contains("-")) {
            var season = date.get("season").asText().trim();
            if (season.matches("[1-4]")) {
                result = result + "-2" + season;
            }
        }
        if (date.path("circa").asBoolean(false) || "1".equals(date.path("circa").asText())) {
            result = "~" + result;
        }
        return result;
    }

    private static String pad(String raw) {
        return raw.length() == 1 ? "0" + raw : raw;
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        var text = value.asText();
        return text.isBlank() ? null : text;
    }
}
