package work.citeproc.engine.sort;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.citeproc.engine.data.CiteItem;
import work.citeproc.engine.data.Entry;
import work.citeproc.engine.data.Name;
import work.citeproc.engine.runtime.RenderTarget;
import work.citeproc.engine.style.Style;
import work.citeproc.engine.support.CiteprocTestSupport;

class SortEngineTest {
    private static final Name DOE = Name.of("Doe", "Jane");
    private static final Name ROE = Name.of("Roe", "Richard");

    private static Style sorted(String keys) {
        return CiteprocTestSupport.style(
            "<macro name=\"author\"><names variable=\"author\"><name name-as-sort-order=\"all\"/></names></macro>"
                + "<citation><sort><key variable=\"issued\"/></sort><layout><text variable=\"title\"/></layout></citation>"
                + "<bibliography><sort>" + keys + "</sort><layout><text macro=\"author\"/></layout></bibliography>");
    }

    private static List<String> ids(List<Entry> entries) {
        var ids = new ArrayList<String>();
        entries.forEach(entry -> ids.add(entry.id()));
        return ids;
    }

    private static Map<String, Integer> order(List<Entry> entries) {
        var order = new LinkedHashMap<String, Integer>();
        entries.forEach(entry -> order.put(entry.id(), order.size()));
        return order;
    }

    @Test
    void sortsByMacroThenDate() {
        var entries = List.of(
            CiteprocTestSupport.book("roe2019", "2019", ROE),
            CiteprocTestSupport.book("doe2021", "2021", DOE),
            CiteprocTestSupport.book("doe2020", "2020", DOE));
        var engine = new SortEngine(sorted("<key macro=\"author\"/><key variable=\"issued\"/>"), CiteprocTestSupport.enUs());
        assertEquals(List.of("doe2020", "doe2021", "roe2019"), ids(engine.sortBibliography(entries, order(entries))));
    }

    @Test
    void descendingKeysStillSortEmptyValuesLast() {
        var undated = Entry.builder("undated").name("author", DOE).build();
        var entries = List.of(
            undated,
            CiteprocTestSupport.book("a2019", "2019", DOE),
            CiteprocTestSupport.book("a2021", "2021", DOE));
        var engine = new SortEngine(sorted("<key variable=\"issued\" sort=\"descending\"/>"), CiteprocTestSupport.enUs());
        assertEquals(List.of("a2021", "a2019", "undated"), ids(engine.sortBibliography(entries, order(entries))));
    }

    @Test
    void tiesKeepCiteOrder() {
        var entries = List.of(
            CiteprocTestSupport.book("second", "2020", DOE),
            CiteprocTestSupport.book("first", "2020", DOE));
        var engine = new SortEngine(sorted("<key macro=\"author\"/>"), CiteprocTestSupport.enUs());
        assertEquals(List.of("second", "first"), ids(engine.sortBibliography(entries, order(entries))));
    }

    @Test
    void numericStylesWithoutCitationNumberKeyKeepCiteOrder() {
        var style = CiteprocTestSupport.style("<citation><layout><text variable=\"citation-number\"/></layout></citation>"
            + "<bibliography><sort><key macro=\"missing\"/></sort>"
            + "<layout><text variable=\"citation-number\"/></layout></bibliography>");
        var entries = List.of(
            CiteprocTestSupport.book("zeta", "2020", ROE),
            CiteprocTestSupport.book("alpha", "2010", DOE));
        var engine = new SortEngine(style, CiteprocTestSupport.enUs());
        assertEquals(List.of("zeta", "alpha"), ids(engine.sortBibliography(entries, order(entries))));
    }

    @Test
    void citationNumberKeyCanReverseTheBibliography() {
        var style = CiteprocTestSupport.style("<citation><layout><text variable=\"citation-number\"/></layout></citation>"
            + "<bibliography><sort><key variable=\"citation-number\" sort=\"descending\"/></sort>"
            + "<layout><text variable=\"citation-number\"/></layout></bibliography>");
        var entries = List.of(
            CiteprocTestSupport.book("one", "2020", DOE),
            CiteprocTestSupport.book("two", "2020", DOE),
            CiteprocTestSupport.book("three", "2020", DOE));
        var engine = new SortEngine(style, CiteprocTestSupport.enUs());
        assertEquals(List.of("three", "two", "one"), ids(engine.sortBibliography(entries, order(entries))));
    }

    @Test
    void sortsClusterItemsByCitationKeys() {
        var entries = new LinkedHashMap<String, Entry>();
        entries.put("late", CiteprocTestSupport.book("late", "2021", DOE));
        entries.put("early", CiteprocTestSupport.book("early", "1999", ROE));
        var engine = new SortEngine(sorted("<key macro=\"author\"/>"), CiteprocTestSupport.enUs());
        var items = List.of(CiteItem.of("late"), CiteItem.of("early"));
        var sorted = engine.sortCluster(items, entries, Map.of("late", 1, "early", 2));
        assertEquals("early", sorted.get(0).id());
        assertEquals("late", sorted.get(1).id());
    }

    @Test
    void buildsComparableKeyValues() {
        var style = CiteprocTestSupport.style(
            "<macro name=\"names\"><names variable=\"author\"><name form=\"short\"/></names></macro>"
                + "<citation><layout><text variable=\"title\"/></layout></citation>"
                + "<bibliography><sort>"
                + "<key variable=\"issued\"/><key variable=\"volume\"/><key variable=\"author\"/>"
                + "<key macro=\"names\" names-min=\"2\" names-use-first=\"1\"/>"
                + "</sort><layout><text macro=\"names\"/></layout></bibliography>");
        var entry = Entry.builder("x")
            .field("issued", "2020-03-05")
            .field("volume", "12")
            .names("author", List.of(DOE, ROE, Name.of("Poe", "Ann")))
            .build();
        var engine = new SortEngine(style, CiteprocTestSupport.enUs());
        var key = engine.key(entry, style.bibliography().orElseThrow(), RenderTarget.BIBLIOGRAPHY, 0, 1);
        assertEquals(List.of("120200305", "0000000012", "Doe Jane, Roe Richard, Poe Ann", "Doe et al."), key.values());
    }
}
