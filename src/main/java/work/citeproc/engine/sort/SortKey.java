package work.citeproc.engine.sort;

import java.util.List;

/**
 * Comparable key values of one entry, in {@code <sort>} key order. {@code citeOrder} breaks ties.
 */
public record SortKey(String id, List<String> values, int citeOrder) {
    public SortKey {
        values = List.copyOf(values);
    }
}
