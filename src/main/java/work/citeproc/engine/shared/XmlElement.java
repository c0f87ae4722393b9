package work.citeproc.engine.shared;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal mutable element tree produced by {@link XmlTreeReader}; converted into immutable models right after parsing.
 */
public final class XmlElement {
    private final String name;
    private final Map<String, String> attributes;
    private final List<XmlElement> children = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();

    public XmlElement(String name, Map<String, String> attributes) {
        this.name = name;
        this.attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
    }

    public String name() {
        return name;
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public List<XmlElement> children() {
        return Collections.unmodifiableList(children);
    }

    public List<XmlElement> children(String childName) {
        var matches = new ArrayList<XmlElement>();
        for (var child : children) {
            if (child.name.equals(childName)) {
                matches.add(child);
            }
        }
        return matches;
    }

    public XmlElement child(String childName) {
        for (var child : children) {
            if (child.name.equals(childName)) {
                return child;
            }
        }
        return null;
    }

    public String text() {
        return text.toString();
    }

    void addChild(XmlElement child) {
        children.add(child);
    }

    void appendText(char[] ch, int start, int length) {
        text.append(ch, start, length);
    }
}
