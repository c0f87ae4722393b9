package work.citeproc.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.citeproc.engine.data.Entry;
import work.citeproc.engine.data.Name;
import work.citeproc.engine.data.Position;
import work.citeproc.engine.disambiguation.DisambiguationState;
import work.citeproc.engine.support.CiteprocTestSupport;

class NameFormatterTest {
    private static final Name DOE = Name.of("Doe", "Jane");
    private static final Name ROE = Name.of("Roe", "Richard");
    private static final Name POE = Name.of("Poe", "Ann");
    private static final Name LOE = Name.of("Loe", "Tom");

    private static Entry authors(Name... names) {
        return Entry.builder("item").type("book").names("author", List.of(names)).build();
    }

    private static String render(String names, Entry entry) {
        return render("", names, entry);
    }

    private static String render(String rootAttributes, String names, Entry entry) {
        var style = CiteprocTestSupport.style(rootAttributes,
            "<citation><layout>" + names + "</layout></citation>"
                + "<bibliography><layout>" + names + "</layout></bibliography>");
        return CiteprocTestSupport.renderBibliography(style, entry);
    }

    private static String authorNames(String nameAttributes) {
        return "<names variable=\"author\"><name " + nameAttributes + "/></names>";
    }

    @Test
    void invertsAllNamesAndKeepsSuffixWithoutComma() {
        var smith = new Name("Smith", "John", null, null, "Jr.", null);
        assertEquals("Smith, John Jr.", render(authorNames("name-as-sort-order=\"all\""), authors(smith)));
        assertEquals("John Smith Jr.", render(authorNames(""), authors(smith)));
    }

    @Test
    void rendersGivenOnlyNamesWithoutStraySeparators() {
        var plato = new Name(null, "Plato", null, null, null, null);
        assertEquals("Plato", render(authorNames(""), authors(plato)));
        assertEquals("Plato", render(authorNames("name-as-sort-order=\"all\""), authors(plato)));
        assertEquals("Plato", render(authorNames("form=\"short\""), authors(plato)));
        assertEquals("Plato and Jane Doe", render(authorNames("and=\"text\""), authors(plato, DOE)));
    }

    @Test
    void truncatesWithEtAl() {
        var entry = authors(DOE, ROE, POE, LOE);
        assertEquals("Jane Doe et al.", render(authorNames("et-al-min=\"4\" et-al-use-first=\"1\""), entry));
        assertEquals("Jane Doe, Richard Roe, et al.",
            render(authorNames("et-al-min=\"4\" et-al-use-first=\"2\""), entry));
        assertEquals("Jane Doe, Richard Roe, Ann Poe, Tom Loe",
            render(authorNames("et-al-min=\"5\" et-al-use-first=\"1\""), entry));
    }

    @Test
    void inheritsEtAlOptionsFromTheStyleRoot() {
        var entry = authors(DOE, ROE, POE, LOE);
        assertEquals("Jane Doe et al.", render("et-al-min=\"3\" et-al-use-first=\"1\"", authorNames(""), entry));
    }

    @Test
    void rendersEtAlTermOverridesAndUseLast() {
        var names = new ArrayList<Name>();
        for (var family : List.of("A", "B", "C", "D", "E", "F", "G", "H")) {
            names.add(Name.of(family, "X"));
        }
        var entry = Entry.builder("item").names("author", names).build();
        assertEquals("A, B, C, D, E, F, … H", render(
            authorNames("form=\"short\" et-al-min=\"7\" et-al-use-first=\"6\" et-al-use-last=\"true\""), entry));
        assertEquals("A and others", render("<names variable=\"author\">"
            + "<name form=\"short\" et-al-min=\"3\" et-al-use-first=\"1\"/><et-al term=\"and others\"/></names>", entry));
    }

    @Test
    void joinsWithAndTerms() {
        assertEquals("Jane Doe and Richard Roe", render(authorNames("and=\"text\""), authors(DOE, ROE)));
        assertEquals("Jane Doe & Richard Roe", render(authorNames("and=\"symbol\""), authors(DOE, ROE)));
        assertEquals("Jane Doe, Richard Roe, and Ann Poe", render(authorNames("and=\"text\""), authors(DOE, ROE, POE)));
        assertEquals("Jane Doe, Richard Roe and Ann Poe",
            render(authorNames("and=\"text\" delimiter-precedes-last=\"never\""), authors(DOE, ROE, POE)));
        assertEquals("Doe, Jane, and Richard Roe", render(
            authorNames("and=\"text\" name-as-sort-order=\"first\" delimiter-precedes-last=\"after-inverted-name\""),
            authors(DOE, ROE)));
    }

    @Test
    void initializesGivenNames() {
        var tolkien = Name.of("Tolkien", "John Ronald");
        assertEquals("J. R. Tolkien", render(authorNames("initialize-with=\". \""), authors(tolkien)));
        assertEquals("Tolkien, J.R.",
            render(authorNames("initialize-with=\".\" name-as-sort-order=\"all\""), authors(tolkien)));
        assertEquals("J.-P.", NameFormatter.initialize("Jean-Paul", ". ", true));
        assertEquals("J.P.", NameFormatter.initialize("Jean-Paul", ". ", false));
        assertEquals("J. R. R.", NameFormatter.initialize("John R. R.", ". ", true));
    }

    @Test
    void placesParticlesByDemotionRule() {
        var beethoven = new Name("Beethoven", "Ludwig", "van", null, null, null);
        assertEquals("Ludwig van Beethoven", render(authorNames(""), authors(beethoven)));
        assertEquals("Beethoven, Ludwig van", render(authorNames("name-as-sort-order=\"all\""), authors(beethoven)));
        assertEquals("van Beethoven, Ludwig", render("demote-non-dropping-particle=\"never\"",
            authorNames("name-as-sort-order=\"all\""), authors(beethoven)));
        assertEquals("van Beethoven", render(authorNames("form=\"short\""), authors(beethoven)));
    }

    @Test
    void formatsNameParts() {
        var names = "<names variable=\"author\"><name><name-part name=\"family\" text-case=\"uppercase\"/></name></names>";
        assertEquals("Jane DOE", render(names, authors(DOE)));
    }

    @Test
    void rendersLabelsOnEitherSide() {
        var entry = Entry.builder("item").names("editor", List.of(DOE, ROE)).build();
        assertEquals("Jane Doe, Richard Roe (eds.)", render("<names variable=\"editor\"><name/>"
            + "<label form=\"short\" prefix=\" (\" suffix=\")\"/></names>", entry));
        assertEquals("edited by Jane Doe, Richard Roe", render("<names variable=\"editor\">"
            + "<label form=\"verb\" suffix=\" \"/><name/></names>", entry));
    }

    @Test
    void mergesIdenticalEditorAndTranslator() {
        var entry = Entry.builder("item").name("editor", DOE).name("translator", DOE).build();
        assertEquals("Jane Doe, ed. & tran.", render("<names variable=\"editor translator\"><name/>"
            + "<label form=\"short\" prefix=\", \"/></names>", entry));
    }

    @Test
    void countsNames() {
        assertEquals("3", render(authorNames("form=\"count\""), authors(DOE, ROE, POE)));
        assertEquals("1", render(authorNames("form=\"count\" et-al-min=\"3\" et-al-use-first=\"1\""),
            authors(DOE, ROE, POE)));
    }

    @Test
    void countsOnlyNamesThatSurviveSuppression() {
        var five = authors(DOE, ROE, POE, LOE, Name.of("Moe", "Kim"));
        assertEquals("", render(authorNames("form=\"count\" suppress-min=\"3\""), five));
        assertEquals("5", render(authorNames("form=\"count\" suppress-min=\"6\""), five));
        assertEquals("2", render(authorNames("form=\"count\" suppress-max=\"2\""), authors(DOE, ROE)));
        assertEquals("3", render(authorNames("form=\"count\" suppress-max=\"2\""), authors(DOE, ROE, POE)));
        assertEquals("1", render(authorNames("form=\"count\" suppress-min=\"0\""),
            authors(DOE, Name.literal("ACME"))));
    }

    @Test
    void formatsInstitutions() {
        var university = Name.literal("University of X|Department of Y");
        assertEquals("University of X, Department of Y", render(authorNames(""), authors(university)));
        assertEquals("Department of Y; University of X", render("<names variable=\"author\"><name/>"
            + "<institution reverse-order=\"true\" delimiter=\"; \"/></names>", authors(university)));
        assertEquals("Department of Y", render("<names variable=\"author\"><name/>"
            + "<institution use-last=\"1\"/></names>", authors(university)));
    }

    @Test
    void groupsPersonalNamesWithTheirInstitution() {
        var acme = Name.literal("ACME");
        assertEquals("Jane Doe, ACME", render(authorNames(""), authors(DOE, acme)));
        assertEquals("Jane Doe with ACME", render(authorNames(""), authors(acme, DOE)));
    }

    @Test
    void suppressesByNameCount() {
        var acme = Name.literal("ACME");
        assertEquals("ACME", render(authorNames("suppress-min=\"0\""), authors(DOE, acme)));
        assertEquals("", render(authorNames("suppress-min=\"2\""), authors(DOE, ROE)));
        assertEquals("Jane Doe, Richard Roe", render(authorNames("suppress-min=\"3\""), authors(DOE, ROE)));
        assertEquals("", render(authorNames("suppress-max=\"2\""), authors(DOE, ROE)));
    }

    @Test
    void appliesDisambiguationOverridesInCitations() {
        var style = CiteprocTestSupport.style("<citation><layout>" + authorNames("form=\"short\"")
            + "</layout></citation>");
        var entry = authors(DOE);
        var layout = style.citation().layoutFor(null);

        var plain = CiteprocTestSupport.context(style, entry).target(RenderTarget.CITATION).build();
        assertEquals("Doe", Interpreter.renderLayout(layout, plain).plainText());

        var initials = CiteprocTestSupport.context(style, entry).target(RenderTarget.CITATION)
            .state(DisambiguationState.INITIAL.withGivennameLevel(1)).build();
        assertEquals("J. Doe", Interpreter.renderLayout(layout, initials).plainText());

        var full = CiteprocTestSupport.context(style, entry).target(RenderTarget.CITATION)
            .state(DisambiguationState.INITIAL.withGivennameLevel(2)).build();
        assertEquals("Jane Doe", Interpreter.renderLayout(layout, full).plainText());
    }

    @Test
    void expandsTruncatedListsForDisambiguation() {
        var style = CiteprocTestSupport.style("<citation><layout>"
            + authorNames("form=\"short\" et-al-min=\"3\" et-al-use-first=\"1\"") + "</layout></citation>");
        var entry = authors(DOE, ROE, POE);
        var layout = style.citation().layoutFor(null);
        var ctx = CiteprocTestSupport.context(style, entry).target(RenderTarget.CITATION)
            .state(DisambiguationState.INITIAL.withNamesExpanded(1)).build();
        assertEquals("Doe, Roe, et al.", Interpreter.renderLayout(layout, ctx).plainText());
        assertEquals(2, NameFormatter.shownNames(style.firstNames(layout).orElseThrow(), 3, ctx));
    }

    @Test
    void usesSubsequentEtAlSettingsAfterFirstCite() {
        var style = CiteprocTestSupport.style("<citation et-al-min=\"5\" et-al-use-first=\"5\" "
            + "et-al-subsequent-min=\"3\" et-al-subsequent-use-first=\"1\"><layout>"
            + authorNames("form=\"short\"") + "</layout></citation>");
        var entry = authors(DOE, ROE, POE);
        var layout = style.citation().layoutFor(null);
        var first = CiteprocTestSupport.context(style, entry).target(RenderTarget.CITATION).build();
        assertEquals("Doe, Roe, Poe", Interpreter.renderLayout(layout, first).plainText());
        var subsequent = CiteprocTestSupport.context(style, entry).target(RenderTarget.CITATION)
            .position(Position.SUBSEQUENT).build();
        assertEquals("Doe et al.", Interpreter.renderLayout(layout, subsequent).plainText());
    }

    @Test
    void warnsAboutShortInstitutionParts() {
        var style = CiteprocTestSupport.bibliographyStyle("", "<names variable=\"author\"><name/>"
            + "<institution institution-parts=\"short\"/></names>");
        var ctx = CiteprocTestSupport.context(style, authors(Name.literal("ACME"))).build();
        var output = Interpreter.renderLayout(style.bibliography().orElseThrow().layoutFor(null), ctx);
        assertEquals("ACME", output.plainText());
        assertFalse(ctx.warnings().isEmpty());
    }
}
