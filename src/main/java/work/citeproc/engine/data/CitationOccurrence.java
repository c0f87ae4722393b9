package work.citeproc.engine.data;

import java.util.List;

/**
 * A placed citation cluster. {@code position} may be supplied by the document scanner; when {@code null}
 * the session computes it per item.
 */
public record CitationOccurrence(String citationId, List<CiteItem> items, Integer noteNumber, Position position) {
    public CitationOccurrence {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static CitationOccurrence of(String citationId, CiteItem... items) {
        return new CitationOccurrence(citationId, List.of(items), null, null);
    }

    public static CitationOccurrence inNote(String citationId, int noteNumber, CiteItem... items) {
        return new CitationOccurrence(citationId, List.of(items), noteNumber, null);
    }
}
