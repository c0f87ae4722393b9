package work.citeproc.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.citeproc.engine.data.CiteItem;
import work.citeproc.engine.data.Entry;
import work.citeproc.engine.data.Position;
import work.citeproc.engine.disambiguation.DisambiguationState;
import work.citeproc.engine.style.Style;
import work.citeproc.engine.support.CiteprocTestSupport;

class ConditionEvaluatorTest {
    private static final Entry BOOK = Entry.builder("book")
        .type("book")
        .field("title", "A Title")
        .field("volume", "12")
        .field("page", "10-20")
        .field("genre", "PhD dissertation")
        .field("issued", "2020-03-05")
        .field("accessed", "2020")
        .field("original-date", "~1850")
        .field("event-date", "2019-22")
        .name("author", CiteprocTestSupport.person("Doe", "Jane"))
        .name("author", CiteprocTestSupport.person("Roe", "Richard"))
        .build();

    private static Style choose(String condition) {
        var branch = "<choose><if " + condition + "><text value=\"yes\"/></if><else><text value=\"no\"/></else></choose>";
        return CiteprocTestSupport.style("<citation><layout>" + branch + "</layout></citation>"
            + "<bibliography><layout>" + branch + "</layout></bibliography>");
    }

    private static boolean inBibliography(String condition) {
        return "yes".equals(CiteprocTestSupport.renderBibliography(choose(condition), BOOK));
    }

    private static boolean inCitation(String condition, RenderContext.Builder builder) {
        var style = choose(condition);
        return "yes".equals(Interpreter.renderLayout(style.citation().layoutFor(null), builder.build()).plainText());
    }

    private static RenderContext.Builder citation(String condition) {
        return RenderContext.builder(choose(condition), BOOK, CiteprocTestSupport.enUs()).target(RenderTarget.CITATION);
    }

    @Test
    void testsTypesAndVariables() {
        assertTrue(inBibliography("type=\"book\""));
        assertFalse(inBibliography("type=\"book chapter\""));
        assertTrue(inBibliography("type=\"book chapter\" match=\"any\""));
        assertTrue(inBibliography("variable=\"title\""));
        assertFalse(inBibliography("variable=\"DOI\""));
        assertTrue(inBibliography("variable=\"author\""));
        assertTrue(inBibliography("variable=\"DOI\" match=\"none\""));
        assertTrue(inBibliography("variable=\"title DOI\" match=\"nand\""));
        assertTrue(inBibliography("genre=\"phd dissertation\""));
    }

    @Test
    void testsNumbersAndMultiples() {
        assertTrue(inBibliography("is-numeric=\"volume\""));
        assertFalse(inBibliography("is-numeric=\"title\""));
        assertTrue(inBibliography("is-multiple=\"page\""));
        assertFalse(inBibliography("is-multiple=\"volume\""));
        assertTrue(inBibliography("is-multiple=\"author\""));
    }

    @Test
    void testsDateShapes() {
        assertTrue(inBibliography("has-day=\"issued\""));
        assertFalse(inBibliography("has-day=\"accessed\""));
        assertTrue(inBibliography("has-year-only=\"accessed\""));
        assertFalse(inBibliography("has-year-only=\"issued\""));
        assertTrue(inBibliography("has-to-month-or-season=\"event-date\""));
        assertTrue(inBibliography("is-uncertain-date=\"original-date\""));
        assertFalse(inBibliography("is-uncertain-date=\"issued\""));
    }

    @Test
    void testsRenderContext() {
        assertTrue(inBibliography("context=\"bibliography\""));
        assertFalse(inBibliography("context=\"citation\""));
        assertTrue(inCitation("context=\"citation\"", citation("context=\"citation\"")));
        // the bibliography only knows first positions
        assertTrue(inBibliography("position=\"first\""));
        assertFalse(inBibliography("position=\"subsequent\""));
    }

    @Test
    void testsCitePositions() {
        var ibid = "position=\"ibid\"";
        assertTrue(inCitation(ibid, citation(ibid).position(Position.IBID_WITH_LOCATOR)));
        assertFalse(inCitation(ibid, citation(ibid).position(Position.SUBSEQUENT)));

        var subsequent = "position=\"subsequent\"";
        assertTrue(inCitation(subsequent, citation(subsequent).position(Position.IBID)));
        assertFalse(inCitation(subsequent, citation(subsequent)));

        var near = "position=\"near-note\"";
        assertTrue(inCitation(near, citation(near).position(Position.SUBSEQUENT).noteNumber(7).previousNoteNumber(4)));
        assertFalse(inCitation(near,
            citation(near).position(Position.SUBSEQUENT).noteNumber(7).previousNoteNumber(4).nearNoteDistance(2)));
        var far = "position=\"far-note\"";
        assertTrue(inCitation(far, citation(far).position(Position.SUBSEQUENT).noteNumber(20).previousNoteNumber(4)));
    }

    @Test
    void testsLocatorsAndDisambiguation() {
        var chapter = "locator=\"chapter\"";
        assertTrue(inCitation(chapter, citation(chapter).item(CiteItem.withLocator("book", "3", "chapter"))));
        assertFalse(inCitation(chapter, citation(chapter).item(CiteItem.withLocator("book", "3", null))));
        var page = "locator=\"page\"";
        assertTrue(inCitation(page, citation(page).item(CiteItem.withLocator("book", "3", null))));

        var disambiguate = "disambiguate=\"true\"";
        assertFalse(inCitation(disambiguate, citation(disambiguate)));
        assertTrue(inCitation(disambiguate,
            citation(disambiguate).state(DisambiguationState.INITIAL.withDisambiguateCondition())));
    }

    @Test
    void evaluatesNestedConditionBlocks() {
        var style = CiteprocTestSupport.bibliographyStyle("", "<choose><if><conditions match=\"any\">"
            + "<condition variable=\"DOI\"/>"
            + "<condition type=\"book\" variable=\"title\"/>"
            + "</conditions><text value=\"yes\"/></if></choose>");
        assertEquals("yes", CiteprocTestSupport.renderBibliography(style, BOOK));
    }

    @Test
    void combinesResults() {
        assertTrue(ConditionEvaluator.combine("all", List.of(true, true)));
        assertFalse(ConditionEvaluator.combine("all", List.of(true, false)));
        assertTrue(ConditionEvaluator.combine("any", List.of(false, true)));
        assertTrue(ConditionEvaluator.combine("none", List.of(false, false)));
        assertTrue(ConditionEvaluator.combine("nand", List.of(true, false)));
        assertFalse(ConditionEvaluator.combine("nand", List.of(true, true)));
    }
}
