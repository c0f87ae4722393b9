package work.citeproc.engine.style;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable style element: kind, attributes and ordered children.
 *
 * <p>Nodes are shared by every render of a style. Code that needs per-node bookkeeping compares nodes by
 * identity ({@code ==}); record equality is structural.
 */
public record Node(NodeKind kind, Map<String, String> attributes, List<Node> children) {
    public Node {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Node of(NodeKind kind, Map<String, String> attributes) {
        return new Node(kind, attributes, List.of());
    }

    public String attr(String name) {
        return attributes.get(name);
    }

    public String attr(String name, String fallback) {
        var value = attributes.get(name);
        return value == null ? fallback : value;
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public boolean flag(String name) {
        return "true".equals(attributes.get(name));
    }

    public int intAttr(String name, int fallback) {
        var value = attributes.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    public Optional<Node> first(NodeKind childKind) {
        for (var child : children) {
            if (child.kind == childKind) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public List<Node> children(NodeKind childKind) {
        var matches = new ArrayList<Node>();
        for (var child : children) {
            if (child.kind == childKind) {
                matches.add(child);
            }
        }
        return matches;
    }
}
