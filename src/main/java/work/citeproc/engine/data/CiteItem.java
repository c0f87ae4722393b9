package work.citeproc.engine.data;

/**
 * One reference inside a citation cluster.
 */
public record CiteItem(
    String id,
    String locator,
    String label,
    String prefix,
    String suffix,
    boolean suppressAuthor,
    boolean authorOnly
) {
    public static CiteItem of(String id) {
        return new CiteItem(id, null, null, null, null, false, false);
    }

    public static CiteItem withLocator(String id, String locator, String label) {
        return new CiteItem(id, locator, label, null, null, false, false);
    }

    public boolean hasLocator() {
        return locator != null && !locator.isBlank();
    }
}
