package work.citeproc.engine.style;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.xml.sax.SAXException;
import work.citeproc.engine.locale.LocaleParser;
import work.citeproc.engine.locale.LocaleTable;
import work.citeproc.engine.shared.XmlElement;
import work.citeproc.engine.shared.XmlTreeReader;

/**
 * Builds an immutable {@link Style} from CSL 1.0.2 / CSL-M XML.
 */
public final class StyleParser {
    private static final Logger log = LogManager.getLogger(StyleParser.class);
    private static final Set<String> ROOT_NON_OPTIONS = Set.of("class", "version", "default-locale", "xmlns", "demote-non-dropping-particle-default");

    private StyleParser() {}

    public static Style parse(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in, false);
        } catch (IOException ex) {
            throw new StyleException("unreadable_style", "Failed to read style: " + path, ex);
        }
    }

    public static Style parse(InputStream in) {
        return parse(in, false);
    }

    /**
     * @param strict when {@code true}, references to undefined macros are rejected instead of rendering empty
     */
    public static Style parse(InputStream in, boolean strict) {
        XmlElement root;
        try {
            root = XmlTreeReader.read(in);
        } catch (SAXException ex) {
            throw new StyleException("malformed_xml", "Malformed style XML: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new StyleException("unreadable_style", "Failed to read style: " + ex.getMessage(), ex);
        }
        return fromElement(root, strict);
    }

    public static Style parseString(String xml) {
        return parseString(xml, false);
    }

    public static Style parseString(String xml, boolean strict) {
        XmlElement root;
        try {
            root = XmlTreeReader.read(xml);
        } catch (SAXException ex) {
            throw new StyleException("malformed_xml", "Malformed style XML: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new StyleException("unreadable_style", "Failed to read style: " + ex.getMessage(), ex);
        }
        return fromElement(root, strict);
    }

    static Style fromElement(XmlElement root, boolean strict) {
        if (!"style".equals(root.name())) {
            throw new StyleException("unknown_root", "Expected <style> root element but found <" + root.name() + ">");
        }
        var citationElement = root.child("citation");
        if (citationElement == null) {
            throw new StyleException("missing_citation", "Style has no <citation> element");
        }

        var options = new LinkedHashMap<String, String>();
        root.attributes().forEach((key, value) -> {
            if (!ROOT_NON_OPTIONS.contains(key)) {
                options.put(key, value);
            }
        });

        var info = root.child("info");
        String id = null;
        String title = null;
        if (info != null) {
            id = textOf(info.child("id"));
            title = textOf(info.child("title"));
        }

        Map<String, LocaleTable> locales = new LinkedHashMap<>();
        for (var localeElement : root.children("locale")) {
            var table = LocaleParser.fromElement(localeElement);
            var key = table.language() == null ? "" : table.language();
            var previous = locales.get(key);
            locales.put(key, previous == null ? table : LocaleParser.overlay(previous, table));
        }

        Map<String, List<Node>> macros = new LinkedHashMap<>();
        for (var macro : root.children("macro")) {
            var name = macro.attribute("name");
            if (name == null || name.isBlank()) {
                throw new StyleException("unnamed_macro", "Encountered <macro> without a name");
            }
            macros.put(name, toNodes(macro.children()));
        }

        var citation = toDefinition(citationElement);
        var bibliographyElement = root.child("bibliography");
        var bibliography = bibliographyElement == null ? null : toDefinition(bibliographyElement);

        var style = new Style(
            id,
            title,
            StyleClass.from(root.attribute("class")),
            root.attribute("default-locale"),
            options,
            macros,
            citation,
            bibliography,
            locales
        );
        var missing = style.undefinedMacroReferences();
        if (!missing.isEmpty()) {
            if (strict) {
                throw new StyleException("unknown_macro_reference", "Style references undefined macros: " + missing);
            }
            log.debug("Style {} references undefined macros {}; they render empty", style.id(), missing);
        }
        return style;
    }

    private static Definition toDefinition(XmlElement element) {
        var layouts = new ArrayList<Layout>();
        for (var layout : element.children("layout")) {
            var tags = layout.attribute("locale");
            List<String> languages = tags == null || tags.isBlank()
                ? List.of()
                : Arrays.asList(tags.trim().split("\\s+"));
            var attributes = new LinkedHashMap<>(layout.attributes());
            attributes.remove("locale");
            layouts.add(new Layout(languages, attributes, toNodes(layout.children())));
        }
        if (layouts.isEmpty()) {
            throw new StyleException("missing_layout", "<" + element.name() + "> has no <layout>");
        }
        var sortKeys = new ArrayList<SortKeySpec>();
        var sort = element.child("sort");
        if (sort != null) {
            for (var key : sort.children("key")) {
                var attributes = new LinkedHashMap<>(key.attributes());
                sortKeys.add(new SortKeySpec(
                    attributes.remove("variable"),
                    attributes.remove("macro"),
                    "descending".equals(attributes.remove("sort")),
                    attributes
                ));
            }
        }
        return new Definition(element.attributes(), layouts, sortKeys);
    }

    /**
     * Converts rendering elements; used for layouts, macros and localized date formats.
     */
    public static List<Node> toNodes(List<XmlElement> elements) {
        var nodes = new ArrayList<Node>(elements.size());
        for (var element : elements) {
            nodes.add(toNode(element));
        }
        return nodes;
    }

    public static Node toNode(XmlElement element) {
        var kind = NodeKind.fromElement(element.name());
        if (kind == null) {
            throw new StyleException("unknown_element", "Unsupported CSL element <" + element.name() + ">");
        }
        return new Node(kind, element.attributes(), toNodes(element.children()));
    }

    private static String textOf(XmlElement element) {
        if (element == null) {
            return null;
        }
        var text = element.text().trim();
        return text.isEmpty() ? null : text;
    }
}
