package work.citeproc.engine.locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.citeproc.engine.support.CiteprocTestSupport;

class LocaleResolverTest {
    @Test
    void resolvesBuiltinTermsWithFormFallback() {
        var locale = LocaleResolver.builtin("en-US");
        assertEquals("en-US", locale.language());
        assertEquals("and", locale.term("and"));
        assertEquals("p.", locale.term("page", TermForm.SHORT, false));
        assertEquals("pp.", locale.term("page", TermForm.SHORT, true));
        assertEquals("pages", locale.term("page", TermForm.LONG, true));
        // no verb-short form for "et-al": falls back to long
        assertEquals("et al.", locale.term("et-al", TermForm.VERB_SHORT, false));
        assertEquals("", locale.term("no-such-term"));
    }

    @Test
    void formatsOrdinals() {
        var locale = LocaleResolver.builtin("en-US");
        assertEquals("1st", locale.ordinal(1, null));
        assertEquals("2nd", locale.ordinal(2, null));
        assertEquals("11th", locale.ordinal(11, null));
        assertEquals("21st", locale.ordinal(21, null));
        assertEquals("104th", locale.ordinal(104, null));
    }

    @Test
    void resolvesMonthsSeasonsAndDateFormats() {
        var locale = LocaleResolver.builtin("en-US");
        assertEquals("March", locale.month(3, TermForm.LONG));
        assertEquals("", locale.month(13, TermForm.LONG));
        assertEquals("Winter", locale.season(4));
        assertTrue(locale.dateFormat("text").isPresent());
        assertTrue(locale.option("punctuation-in-quote"));
    }

    @Test
    void styleLocaleOverridesBuiltinTerms() {
        var style = CiteprocTestSupport.style(
            "<locale xml:lang=\"en\"><terms><term name=\"et-al\">and colleagues</term></terms></locale>"
                + "<citation><layout><text variable=\"title\"/></layout></citation>");
        var locale = LocaleResolver.of("en-US", style.locales(), List.of());
        assertEquals("and colleagues", locale.term("et-al"));
        assertEquals("and", locale.term("and"));
    }

    @Test
    void suppliedLocaleFileSitsBetweenStyleAndBuiltin() throws Exception {
        var xml = "<locale xmlns=\"http://purl.org/net/xbiblio/csl\" xml:lang=\"en-GB\">"
            + "<style-options punctuation-in-quote=\"false\"/>"
            + "<terms><term name=\"and\">plus</term></terms></locale>";
        var table = LocaleParser.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        var locale = LocaleResolver.of("en-GB", Map.of(), List.of(table));

        assertEquals("en-GB", locale.language());
        assertEquals("plus", locale.term("and"));
        assertFalse(locale.option("punctuation-in-quote"));
        // everything else falls through to the en-US tables
        assertEquals("et al.", locale.term("et-al"));
    }

    @Test
    void unknownLanguageFallsBackToEnglish() {
        var locale = LocaleResolver.builtin("xx-YY");
        assertEquals("xx-YY", locale.language());
        assertEquals("and", locale.term("and"));
    }

    @Test
    void loadsGermanBuiltin() {
        var locale = LocaleResolver.builtin("de");
        assertEquals("und", locale.term("and"));
    }
}
