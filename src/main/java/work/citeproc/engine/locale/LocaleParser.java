package work.citeproc.engine.locale;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.xml.sax.SAXException;
import work.citeproc.engine.shared.XmlElement;
import work.citeproc.engine.shared.XmlTreeReader;
import work.citeproc.engine.style.StyleException;
import work.citeproc.engine.style.StyleParser;

/**
 * Reads CSL locale files ({@code <locale>} root) and style-embedded {@code <locale>} blocks.
 */
public final class LocaleParser {
    private LocaleParser() {}

    public static LocaleTable parse(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException ex) {
            throw new StyleException("unreadable_locale", "Failed to read locale: " + path, ex);
        }
    }

    public static LocaleTable parse(InputStream in) {
        try {
            var root = XmlTreeReader.read(in);
            if (!"locale".equals(root.name())) {
                throw new StyleException("unknown_root", "Expected <locale> root element but found <" + root.name() + ">");
            }
            return fromElement(root);
        } catch (SAXException ex) {
            throw new StyleException("malformed_xml", "Malformed locale XML: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new StyleException("unreadable_locale", "Failed to read locale: " + ex.getMessage(), ex);
        }
    }

    public static LocaleTable fromElement(XmlElement element) {
        var builder = LocaleTable.builder(element.attribute("xml:lang"));
        var styleOptions = element.child("style-options");
        if (styleOptions != null) {
            styleOptions.attributes().forEach(builder::option);
        }
        for (var date : element.children("date")) {
            var form = date.attribute("form");
            if (form != null) {
                builder.dateFormat(form, StyleParser.toNode(date));
            }
        }
        var terms = element.child("terms");
        if (terms != null) {
            for (var term : terms.children("term")) {
                builder.term(toTerm(term));
            }
        }
        return builder.build();
    }

    /**
     * Merges two tables of the same language; entries of {@code top} win.
     */
    public static LocaleTable overlay(LocaleTable base, LocaleTable top) {
        var builder = LocaleTable.builder(top.language() != null ? top.language() : base.language());
        base.terms().values().forEach(builder::term);
        top.terms().values().forEach(builder::term);
        for (var form : new String[] {"text", "numeric"}) {
            top.dateFormat(form).or(() -> base.dateFormat(form)).ifPresent(node -> builder.dateFormat(form, node));
        }
        for (var option : new String[] {"punctuation-in-quote", "limit-day-ordinals-to-day-1"}) {
            top.option(option).or(() -> base.option(option)).ifPresent(value -> builder.option(option, value));
        }
        return builder.build();
    }

    private static Term toTerm(XmlElement term) {
        var single = term.child("single");
        var multiple = term.child("multiple");
        String singleText;
        String multipleText = null;
        if (single != null || multiple != null) {
            singleText = single == null ? "" : single.text();
            multipleText = multiple == null ? null : multiple.text();
        } else {
            singleText = term.text();
        }
        return new Term(
            term.attribute("name"),
            TermForm.from(term.attribute("form")),
            singleText,
            multipleText,
            term.attribute("gender"),
            term.attribute("gender-form"),
            term.attribute("match")
        );
    }
}
