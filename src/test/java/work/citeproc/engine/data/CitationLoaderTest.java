package work.citeproc.engine.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class CitationLoaderTest {
    @Test
    void readsClustersInEveryShorthand() throws Exception {
        var clusters = CitationLoader.fromJson("""
            [
              {"id": "c1", "noteNumber": 3, "position": "ibid-with-locator",
               "items": [{"id": "doe", "locator": "12", "label": "chapter", "prefix": "see ",
                          "suppress-author": true}]},
              ["doe", "roe"],
              "roe"
            ]
            """);

        assertEquals(3, clusters.size());
        var first = clusters.get(0);
        assertEquals("c1", first.citationId());
        assertEquals(3, first.noteNumber());
        assertEquals(Position.IBID_WITH_LOCATOR, first.position());
        var item = first.items().get(0);
        assertEquals("12", item.locator());
        assertEquals("chapter", item.label());
        assertEquals("see ", item.prefix());
        assertTrue(item.suppressAuthor());

        assertEquals("CITATION-2", clusters.get(1).citationId());
        assertEquals(2, clusters.get(1).items().size());
        assertNull(clusters.get(1).noteNumber());
        assertEquals("roe", clusters.get(2).items().get(0).id());
    }

    @Test
    void rejectsItemsWithoutIds() {
        assertThrows(IOException.class, () -> CitationLoader.fromJson("[{\"items\": [{\"locator\": \"1\"}]}]"));
        assertThrows(IOException.class, () -> CitationLoader.fromJson("{\"items\": []}"));
    }
}
