package work.citeproc.engine.collapse;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.citeproc.engine.data.CiteItem;
import work.citeproc.engine.output.Output;
import work.citeproc.engine.support.CiteprocTestSupport;

class CollapseEngineTest {
    private static CollapseEngine engine(String citationAttributes, String delimiter) {
        var style = CiteprocTestSupport.style("<citation " + citationAttributes + ">"
            + "<layout delimiter=\"" + delimiter + "\"><text variable=\"citation-number\"/></layout></citation>");
        return new CollapseEngine(style, CiteprocTestSupport.enUs());
    }

    private static RenderedCite number(int value) {
        var text = Output.text(String.valueOf(value));
        return new RenderedCite(CiteItem.of("ITEM-" + value), text, text, "", value, null, null);
    }

    private static RenderedCite authorDate(String id, String author, String year, Character suffix) {
        return authorDate(CiteItem.of(id), author, year, suffix);
    }

    private static RenderedCite authorDate(CiteItem item, String author, String year, Character suffix) {
        var date = year + (suffix == null ? "" : suffix.toString());
        return new RenderedCite(item, Output.text(author + " " + date), Output.text(date), author, null, year, suffix);
    }

    private static List<RenderedCite> numbers(int... values) {
        var cites = new ArrayList<RenderedCite>();
        for (int value : values) {
            cites.add(number(value));
        }
        return cites;
    }

    @Test
    void collapsesRunsOfThreeOrMoreCitationNumbers() {
        var engine = engine("collapse=\"citation-number\"", ", ");
        assertEquals("1-3, 5", engine.collapse(numbers(1, 2, 3, 5)).plainText());
        assertEquals("1-6", engine.collapse(numbers(1, 2, 3, 4, 5, 6)).plainText());
        assertEquals("1, 2, 4", engine.collapse(numbers(1, 2, 4)).plainText());
    }

    @Test
    void leavesNumbersAloneWithoutCollapsing() {
        assertEquals("1, 2, 3", engine("", ", ").collapse(numbers(1, 2, 3)).plainText());
    }

    @Test
    void doesNotCollapseNumbersCarryingExtraText() {
        var located = new RenderedCite(CiteItem.withLocator("ITEM-2", "5", "page"), Output.text("2, p. 5"),
            Output.text("2, p. 5"), "", 2, null, null);
        var cites = List.of(number(1), located, number(3));
        assertEquals("1; 2, p. 5; 3", engine("collapse=\"citation-number\"", "; ").collapse(cites).plainText());
    }

    @Test
    void groupsCitesByAuthorKeepingFirstAppearanceOrder() {
        var cites = List.of(
            authorDate("a", "Doe", "2019", null),
            authorDate("b", "Roe", "2020", null),
            authorDate("c", "Doe", "2021", null),
            authorDate("d", "", "2022", null),
            authorDate("e", "", "2023", null));

        var groups = CollapseEngine.group(cites);

        assertEquals(4, groups.size());
        assertEquals(List.of("a", "c"), groups.get(0).stream().map(cite -> cite.item().id()).toList());
        assertEquals("b", groups.get(1).get(0).item().id());
    }

    @Test
    void collapsesSameAuthorYears() {
        var cites = List.of(
            authorDate("a", "Doe", "2019", null),
            authorDate("b", "Roe", "2020", null),
            authorDate("c", "Doe", "2021", null));
        assertEquals("Doe 2019, 2021; Roe 2020", engine("collapse=\"year\"", "; ").collapse(cites).plainText());
    }

    @Test
    void honoursCiteGroupAndAfterCollapseDelimiters() {
        var cites = List.of(
            authorDate("a", "Doe", "2019", null),
            authorDate("c", "Doe", "2021", null),
            authorDate("b", "Roe", "2020", null));
        var engine = engine("collapse=\"year\" cite-group-delimiter=\" / \" after-collapse-delimiter=\" | \"", "; ");
        assertEquals("Doe 2019 / 2021 | Roe 2020", engine.collapse(cites).plainText());
    }

    @Test
    void mergesYearSuffixes() {
        var cites = List.of(
            authorDate("a", "Doe", "2020", 'a'),
            authorDate("b", "Doe", "2020", 'b'),
            authorDate("c", "Doe", "2020", 'c'));
        var suffixes = engine("collapse=\"year-suffix\" disambiguate-add-year-suffix=\"true\" year-suffix-delimiter=\",\"", "; ");
        var ranged = engine("collapse=\"year-suffix-ranged\" disambiguate-add-year-suffix=\"true\"", "; ");
        assertEquals("Doe 2020a,b,c", suffixes.collapse(cites).plainText());
        assertEquals("Doe 2020a-c", ranged.collapse(cites).plainText());
    }

    @Test
    void fallsBackToYearCollapseWithoutYearSuffixes() {
        var cites = List.of(
            authorDate("a", "Doe", "2020", 'a'),
            authorDate("b", "Doe", "2020", 'b'));
        assertEquals("Doe 2020a, 2020b", engine("collapse=\"year-suffix\"", "; ").collapse(cites).plainText());
    }

    @Test
    void keepsLocatedCitesOutOfSuffixRuns() {
        var cites = List.of(
            authorDate("a", "Doe", "2020", 'a'),
            authorDate(CiteItem.withLocator("b", "12", "page"), "Doe", "2020", 'b'));
        var engine = engine("collapse=\"year-suffix\" disambiguate-add-year-suffix=\"true\"", "; ");
        assertEquals("Doe 2020a, 2020b", engine.collapse(cites).plainText());
    }
}
