package work.citeproc.engine.style;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of rendering element kinds understood by the interpreter.
 */
public enum NodeKind {
    TEXT("text"),
    GROUP("group"),
    CHOOSE("choose"),
    IF("if"),
    ELSE_IF("else-if"),
    ELSE("else"),
    CONDITIONS("conditions"),
    CONDITION("condition"),
    NAMES("names"),
    NAME("name"),
    NAME_PART("name-part"),
    ET_AL("et-al"),
    SUBSTITUTE("substitute"),
    INSTITUTION("institution"),
    INSTITUTION_PART("institution-part"),
    DATE("date"),
    DATE_PART("date-part"),
    NUMBER("number"),
    LABEL("label");

    private static final Map<String, NodeKind> BY_ELEMENT = new HashMap<>();

    static {
        for (var kind : values()) {
            BY_ELEMENT.put(kind.element, kind);
        }
    }

    private final String element;

    NodeKind(String element) {
        this.element = element;
    }

    public String element() {
        return element;
    }

    /**
     * @return the kind for a CSL element name, or {@code null} when the element is not a rendering element
     */
    public static NodeKind fromElement(String element) {
        return BY_ELEMENT.get(element);
    }
}
