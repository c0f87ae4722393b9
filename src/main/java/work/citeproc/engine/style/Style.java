package work.citeproc.engine.style;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.citeproc.engine.locale.LocaleTable;

/**
 * Parsed style. Built once per style load and shared read-only by every session rendering with it.
 */
public final class Style {
    private final String id;
    private final String title;
    private final StyleClass styleClass;
    private final String defaultLocale;
    private final Map<String, String> options;
    private final Map<String, List<Node>> macros;
    private final Definition citation;
    private final Definition bibliography;
    private final Map<String, LocaleTable> locales;
    private final Set<String> referencedVariables;
    private final Set<String> macroReferences;
    private final boolean disambiguateCondition;

    public Style(
        String id,
        String title,
        StyleClass styleClass,
        String defaultLocale,
        Map<String, String> options,
        Map<String, List<Node>> macros,
        Definition citation,
        Definition bibliography,
        Map<String, LocaleTable> locales
    ) {
        this.id = id;
        this.title = title;
        this.styleClass = styleClass == null ? StyleClass.IN_TEXT : styleClass;
        this.defaultLocale = defaultLocale;
        this.options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
        var macroCopy = new LinkedHashMap<String, List<Node>>();
        if (macros != null) {
            macros.forEach((name, nodes) -> macroCopy.put(name, List.copyOf(nodes)));
        }
        this.macros = Collections.unmodifiableMap(macroCopy);
        this.citation = citation;
        this.bibliography = bibliography;
        this.locales = locales == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(locales));

        var variables = new HashSet<String>();
        var references = new LinkedHashSet<String>();
        var disambiguate = new boolean[1];
        for (var nodes : this.macros.values()) {
            scan(nodes, variables, references, disambiguate);
        }
        for (var definition : definitions()) {
            for (var layout : definition.layouts()) {
                scan(layout.children(), variables, references, disambiguate);
            }
            for (var key : definition.sortKeys()) {
                if (key.variable() != null) {
                    variables.add(key.variable());
                }
                if (key.isMacro()) {
                    references.add(key.macro());
                }
            }
        }
        this.referencedVariables = Collections.unmodifiableSet(variables);
        this.macroReferences = Collections.unmodifiableSet(references);
        this.disambiguateCondition = disambiguate[0];
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public StyleClass styleClass() {
        return styleClass;
    }

    public String defaultLocale() {
        return defaultLocale;
    }

    public Map<String, String> options() {
        return options;
    }

    public String option(String name) {
        return options.get(name);
    }

    public Map<String, List<Node>> macros() {
        return macros;
    }

    /**
     * @return the macro body, or {@code null} when the style does not define it
     */
    public List<Node> macro(String name) {
        return macros.get(name);
    }

    public Definition citation() {
        return citation;
    }

    public Optional<Definition> bibliography() {
        return Optional.ofNullable(bibliography);
    }

    public Map<String, LocaleTable> locales() {
        return locales;
    }

    /**
     * Whether any layout, macro or sort key names {@code variable}.
     */
    public boolean referencesVariable(String variable) {
        return referencedVariables.contains(variable);
    }

    public boolean usesDisambiguateCondition() {
        return disambiguateCondition;
    }

    public Set<String> undefinedMacroReferences() {
        var missing = new LinkedHashSet<String>();
        for (var name : macroReferences) {
            if (!macros.containsKey(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    /**
     * First {@code <names>} element of a layout in document order, looking through macro calls.
     */
    public Optional<Node> firstNames(Layout layout) {
        return findNames(layout.children(), new HashSet<>());
    }

    private Optional<Node> findNames(List<Node> nodes, Set<String> visiting) {
        for (var node : nodes) {
            if (node.kind() == NodeKind.NAMES) {
                return Optional.of(node);
            }
            if (node.kind() == NodeKind.TEXT && node.has("macro")) {
                var name = node.attr("macro");
                var body = macros.get(name);
                if (body != null && visiting.add(name)) {
                    var found = findNames(body, visiting);
                    visiting.remove(name);
                    if (found.isPresent()) {
                        return found;
                    }
                }
                continue;
            }
            var found = findNames(node.children(), visiting);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private List<Definition> definitions() {
        var list = new ArrayList<Definition>(2);
        if (citation != null) {
            list.add(citation);
        }
        if (bibliography != null) {
            list.add(bibliography);
        }
        return list;
    }

    private static void scan(List<Node> nodes, Set<String> variables, Set<String> references, boolean[] disambiguate) {
        for (var node : nodes) {
            var variable = node.attr("variable");
            if (variable != null) {
                for (var token : variable.trim().split("\\s+")) {
                    variables.add(token);
                }
            }
            if (node.kind() == NodeKind.TEXT && node.has("macro")) {
                references.add(node.attr("macro"));
            }
            if (node.has("disambiguate")) {
                disambiguate[0] = true;
            }
            scan(node.children(), variables, references, disambiguate);
        }
    }
}
