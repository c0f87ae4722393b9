package work.citeproc.engine.data;

import java.util.Set;

/**
 * CSL variable families.
 */
public final class Variables {
    public static final Set<String> NAME_VARIABLES = Set.of(
        "author", "chair", "collection-editor", "compiler", "composer", "container-author", "contributor", "curator",
        "director", "editor", "editorial-director", "editor-translator", "executive-producer", "guest", "host",
        "illustrator", "interviewer", "narrator", "organizer", "original-author", "performer", "producer",
        "recipient", "reviewed-author", "script-writer", "series-creator", "translator", "authority"
    );

    public static final Set<String> DATE_VARIABLES = Set.of(
        "accessed", "available-date", "event-date", "issued", "original-date", "submitted", "locator-date"
    );

    public static final Set<String> NUMBER_VARIABLES = Set.of(
        "chapter-number", "citation-number", "collection-number", "edition", "first-reference-note-number",
        "issue", "locator", "number", "number-of-pages", "number-of-volumes", "page", "page-first",
        "part-number", "printing-number", "section", "supplement-number", "version", "volume"
    );

    private Variables() {}

    public static boolean isName(String variable) {
        return NAME_VARIABLES.contains(variable);
    }

    public static boolean isDate(String variable) {
        return DATE_VARIABLES.contains(variable);
    }

    public static boolean isNumber(String variable) {
        return NUMBER_VARIABLES.contains(variable);
    }
}
