package work.citeproc.engine.api;

import java.util.List;

/**
 * Formatted text of one citation cluster.
 */
public record RenderedCitation(String citationId, String text, Integer noteNumber, List<String> itemIds) {
    public RenderedCitation {
        itemIds = List.copyOf(itemIds);
    }
}
