package work.citeproc.engine.api;

/**
 * One rendered reference list entry, in bibliography order.
 *
 * @param textWithoutNumber the same entry rendered without its citation number, for custom numbering layouts
 */
public record BibliographyItem(String id, String text, String textWithoutNumber, int citationNumber) {}
