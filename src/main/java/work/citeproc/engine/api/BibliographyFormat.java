package work.citeproc.engine.api;

import work.citeproc.engine.style.Definition;

/**
 * Layout hints of the bibliography section for the typesetting side.
 */
public record BibliographyFormat(boolean hangingIndent, String secondFieldAlign, int lineSpacing, int entrySpacing) {
    public static final BibliographyFormat DEFAULT = new BibliographyFormat(false, null, 1, 1);

    static BibliographyFormat from(Definition bibliography) {
        return new BibliographyFormat(
            "true".equals(bibliography.option("hanging-indent")),
            bibliography.option("second-field-align"),
            positive(bibliography.option("line-spacing")),
            positive(bibliography.option("entry-spacing"))
        );
    }

    private static int positive(String value) {
        if (value == null) {
            return 1;
        }
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException ex) {
            return 1;
        }
    }
}
