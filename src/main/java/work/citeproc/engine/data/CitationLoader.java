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

/**
 * Loads citation clusters. Each cluster is either an object
 * {@code {"id", "noteNumber", "position", "items": [...]}}, an array of items, or a single item; an item is an
 * id string or an object {@code {"id", "locator", "label", "prefix", "suffix", "suppress-author", "author-only"}}.
 */
public final class CitationLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private CitationLoader() {}

    public static List<CitationOccurrence> load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return load(in, EntryLoader.isYaml(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read citations: " + path, ex);
        }
    }

    public static List<CitationOccurrence> load(InputStream in, boolean yaml) throws IOException {
        return fromTree((yaml ? YAML_MAPPER : JSON_MAPPER).readTree(in));
    }

    public static List<CitationOccurrence> fromJson(String json) throws IOException {
        return fromTree(JSON_MAPPER.readTree(json));
    }

    static List<CitationOccurrence> fromTree(JsonNode root) throws IOException {
        if (root == null || root.isNull()) {
            return List.of();
        }
        if (!root.isArray()) {
            throw new IOException("Citations must be an array of clusters");
        }
        var clusters = new ArrayList<CitationOccurrence>();
        int index = 0;
        for (var node : root) {
            index++;
            clusters.add(toCluster(node, index));
        }
        return clusters;
    }

    private static CitationOccurrence toCluster(JsonNode node, int index) throws IOException {
        var defaultId = "CITATION-" + index;
        if (node.isObject() && node.has("items")) {
            var items = new ArrayList<CiteItem>();
            for (var item : node.get("items")) {
                items.add(toItem(item));
            }
            Integer note = node.hasNonNull("noteNumber") ? node.get("noteNumber").asInt() : null;
            var id = node.hasNonNull("id") ? node.get("id").asText() : defaultId;
            return new CitationOccurrence(id, items, note, Position.from(node.path("position").asText(null)));
        }
        if (node.isArray()) {
            var items = new ArrayList<CiteItem>();
            for (var item : node) {
                items.add(toItem(item));
            }
            return new CitationOccurrence(defaultId, items, null, null);
        }
        return new CitationOccurrence(defaultId, List.of(toItem(node)), null, null);
    }

    private static CiteItem toItem(JsonNode node) throws IOException {
        if (node.isTextual()) {
            return CiteItem.of(node.asText());
        }
        if (!node.isObject() || !node.hasNonNull("id")) {
            throw new IOException("Cite item must be an id or an object with an id: " + node);
        }
        return new CiteItem(
            node.get("id").asText(),
            node.hasNonNull("locator") ? node.get("locator").asText() : null,
            node.hasNonNull("label") ? node.get("label").asText() : null,
            node.hasNonNull("prefix") ? node.get("prefix").asText() : null,
            node.hasNonNull("suffix") ? node.get("suffix").asText() : null,
            node.path("suppress-author").asBoolean(false),
            node.path("author-only").asBoolean(false)
        );
    }
}
