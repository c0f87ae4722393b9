package work.citeproc.engine.style;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.citeproc.engine.support.CiteprocTestSupport;

class StyleParserTest {
    private static final String CITATION = "<citation><layout><text variable=\"title\"/></layout></citation>";

    @Test
    void parsesMacrosOptionsAndSortKeys() {
        var style = CiteprocTestSupport.style("page-range-format=\"expanded\" default-locale=\"de-DE\"",
            "<macro name=\"author\"><names variable=\"author\"/></macro>"
                + "<citation disambiguate-add-year-suffix=\"true\"><layout delimiter=\"; \">"
                + "<text macro=\"author\"/></layout></citation>"
                + "<bibliography hanging-indent=\"true\"><sort><key macro=\"author\" names-min=\"3\"/>"
                + "<key variable=\"issued\" sort=\"descending\"/></sort>"
                + "<layout><text macro=\"author\"/><date variable=\"issued\"><date-part name=\"year\"/></date>"
                + "</layout></bibliography>");

        assertEquals("test-style", style.id());
        assertEquals("Test Style", style.title());
        assertEquals(StyleClass.IN_TEXT, style.styleClass());
        assertEquals("de-DE", style.defaultLocale());
        assertEquals("expanded", style.option("page-range-format"));
        assertNull(style.option("default-locale"));
        assertNotNull(style.macro("author"));
        assertEquals("true", style.citation().option("disambiguate-add-year-suffix"));
        assertEquals("; ", style.citation().layoutFor(null).attr("delimiter", ""));

        var keys = style.bibliography().orElseThrow().sortKeys();
        assertEquals(2, keys.size());
        assertTrue(keys.get(0).isMacro());
        assertEquals(3, keys.get(0).intAttr("names-min"));
        assertFalse(keys.get(0).descending());
        assertEquals("issued", keys.get(1).variable());
        assertTrue(keys.get(1).descending());

        assertTrue(style.referencesVariable("author"));
        assertTrue(style.referencesVariable("issued"));
        assertFalse(style.referencesVariable("year-suffix"));
        assertTrue(style.firstNames(style.citation().layoutFor(null)).isPresent());
    }

    @Test
    void readsNoteClassAndStyleLocales() {
        var style = CiteprocTestSupport.style("class=\"note\"",
            "<locale xml:lang=\"en\"><terms><term name=\"et-al\">and colleagues</term></terms></locale>"
                + CITATION);
        assertEquals(StyleClass.NOTE, style.styleClass());
        assertTrue(style.locales().containsKey("en"));
    }

    @Test
    void picksLanguageSpecificLayouts() {
        var style = CiteprocTestSupport.style("<citation>"
            + "<layout locale=\"de\"><text value=\"de\"/></layout>"
            + "<layout><text value=\"default\"/></layout>"
            + "</citation>");
        var citation = style.citation();
        assertEquals(2, citation.layouts().size());
        assertEquals(List.of("de"), citation.layoutFor("de-AT").locales());
        assertTrue(citation.layoutFor("fr").isDefault());
        assertTrue(citation.layoutFor(null).isDefault());
    }

    @Test
    void detectsDisambiguateConditions() {
        var style = CiteprocTestSupport.style("<citation><layout><choose><if disambiguate=\"true\">"
            + "<text variable=\"title\"/></if></choose></layout></citation>");
        assertTrue(style.usesDisambiguateCondition());
    }

    @Test
    void rejectsUnknownRoot() {
        var ex = assertThrows(StyleException.class, () -> StyleParser.parseString("<locale/>"));
        assertEquals("unknown_root", ex.code());
    }

    @Test
    void rejectsStyleWithoutCitation() {
        var ex = assertThrows(StyleException.class, () -> CiteprocTestSupport.style("<macro name=\"a\"/>"));
        assertEquals("missing_citation", ex.code());
    }

    @Test
    void rejectsCitationWithoutLayout() {
        var ex = assertThrows(StyleException.class, () -> CiteprocTestSupport.style("<citation/>"));
        assertEquals("missing_layout", ex.code());
    }

    @Test
    void rejectsUnnamedMacro() {
        var ex = assertThrows(StyleException.class,
            () -> CiteprocTestSupport.style("<macro><text value=\"x\"/></macro>" + CITATION));
        assertEquals("unnamed_macro", ex.code());
    }

    @Test
    void rejectsUnknownRenderingElement() {
        var ex = assertThrows(StyleException.class,
            () -> CiteprocTestSupport.style("<citation><layout><blink/></layout></citation>"));
        assertEquals("unknown_element", ex.code());
    }

    @Test
    void rejectsMalformedXml() {
        var ex = assertThrows(StyleException.class, () -> StyleParser.parseString("<style><citation>"));
        assertEquals("malformed_xml", ex.code());
    }

    @Test
    void undefinedMacrosFailOnlyInStrictMode() {
        var xml = CiteprocTestSupport.styleXml("", "<citation><layout><text macro=\"missing\"/></layout></citation>");

        var lenient = StyleParser.parseString(xml);
        assertNull(lenient.macro("missing"));
        assertEquals(Set.of("missing"), lenient.undefinedMacroReferences());

        var ex = assertThrows(StyleException.class, () -> StyleParser.parseString(xml, true));
        assertEquals("unknown_macro_reference", ex.code());
    }
}
