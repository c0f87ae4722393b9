package work.citeproc.engine.collapse;

import work.citeproc.engine.data.CiteItem;
import work.citeproc.engine.output.Output;

/**
 * One rendered cite of a cluster, with the pieces collapsing needs.
 *
 * @param withoutAuthor the cite rendered with its first {@code <names>} suppressed
 * @param authorKey rendered first {@code <names>}; empty when the layout has none
 * @param citationNumber assigned number, or {@code null} for uncited ids
 * @param yearSuffix assigned letter, or {@code null}
 */
public record RenderedCite(
    CiteItem item,
    Output full,
    Output withoutAuthor,
    String authorKey,
    Integer citationNumber,
    String year,
    Character yearSuffix
) {
    boolean isBareNumber() {
        return citationNumber != null && full.plainText().equals(citationNumber.toString());
    }
}
