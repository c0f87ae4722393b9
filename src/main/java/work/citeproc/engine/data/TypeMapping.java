package work.citeproc.engine.data;

import java.util.Locale;
import java.util.Map;

/**
 * Maps BibTeX/biblatex and CSL type names onto canonical CSL types. CSL-M legal aliases map to {@code legal_case} and {@code legislation}.
 */
public final class TypeMapping {
    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("article", "article-journal"),
        Map.entry("inbook", "chapter"),
        Map.entry("incollection", "chapter"),
        Map.entry("inproceedings", "paper-conference"),
        Map.entry("conference", "paper-conference"),
        Map.entry("proceedings", "book"),
        Map.entry("collection", "book"),
        Map.entry("mvbook", "book"),
        Map.entry("booklet", "pamphlet"),
        Map.entry("phdthesis", "thesis"),
        Map.entry("mastersthesis", "thesis"),
        Map.entry("techreport", "report"),
        Map.entry("manual", "report"),
        Map.entry("unpublished", "manuscript"),
        Map.entry("online", "webpage"),
        Map.entry("electronic", "webpage"),
        Map.entry("www", "webpage"),
        Map.entry("misc", "document"),
        Map.entry("patent", "patent"),
        Map.entry("periodical", "periodical"),
        Map.entry("jurisdiction", "legal_case"),
        Map.entry("legal-case", "legal_case"),
        Map.entry("case", "legal_case"),
        Map.entry("statute", "legislation"),
        Map.entry("legal", "legislation"),
        Map.entry("software", "software"),
        Map.entry("dataset", "dataset")
    );

    private TypeMapping() {}

    public static String canonical(String type) {
        if (type == null || type.isBlank()) {
            return "document";
        }
        var normalized = type.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(normalized, normalized);
    }
}
