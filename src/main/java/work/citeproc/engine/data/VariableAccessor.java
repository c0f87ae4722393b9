package work.citeproc.engine.data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read view of an entry in CSL variable space: entry fields, type-specific fallbacks and virtual variables
 * injected for one render (citation-number, year-suffix, locator, ...).
 */
public final class VariableAccessor {
    private static final Map<String, List<String>> FIELD_FALLBACKS = Map.ofEntries(
        Map.entry("container-title", List.of("journal", "journaltitle", "booktitle")),
        Map.entry("container-title-short", List.of("journalAbbreviation", "shortjournal")),
        Map.entry("title-short", List.of("shortTitle", "shorttitle")),
        Map.entry("publisher-place", List.of("address", "location")),
        Map.entry("URL", List.of("url")),
        Map.entry("DOI", List.of("doi")),
        Map.entry("ISBN", List.of("isbn")),
        Map.entry("ISSN", List.of("issn")),
        Map.entry("collection-title", List.of("series")),
        Map.entry("number", List.of("report-number"))
    );

    private final Entry entry;
    private final Map<String, String> injected;

    public VariableAccessor(Entry entry, Map<String, String> injected) {
        this.entry = entry;
        this.injected = injected == null ? Map.of() : new LinkedHashMap<>(injected);
    }

    public Entry entry() {
        return entry;
    }

    public String type() {
        return TypeMapping.canonical(entry.type());
    }

    /**
     * @return the value of a non-name variable, or {@code null} when absent or blank
     */
    public String value(String variable) {
        if (variable == null) {
            return null;
        }
        var direct = injected.get(variable);
        if (notBlank(direct)) {
            return direct;
        }
        var field = entry.field(variable);
        if (notBlank(field)) {
            return field;
        }
        if ("publisher".equals(variable)) {
            return publisherFallback();
        }
        if ("citation-label".equals(variable)) {
            return citationLabel();
        }
        for (var alias : FIELD_FALLBACKS.getOrDefault(variable, List.of())) {
            var candidate = entry.field(alias);
            if (notBlank(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    public List<Name> names(String role) {
        return entry.names(role);
    }

    public boolean has(String variable) {
        if (Variables.isName(variable)) {
            return !names(variable).isEmpty();
        }
        return value(variable) != null;
    }

    /**
     * Family of the first author, falling back to editor and translator; literal for institutions.
     */
    public String firstAuthorFamily() {
        for (var role : List.of("author", "editor", "translator")) {
            var names = names(role);
            if (!names.isEmpty()) {
                return names.get(0).familyWithParticle();
            }
        }
        return "";
    }

    public String year() {
        var issued = value("issued");
        if (issued == null) {
            return "";
        }
        var digits = new StringBuilder();
        for (char c : issued.toCharArray()) {
            if (Character.isDigit(c)) {
                digits.append(c);
                if (digits.length() == 4) {
                    break;
                }
            } else if (digits.length() > 0) {
                break;
            }
        }
        return digits.toString();
    }

    private String publisherFallback() {
        var type = type();
        if ("thesis".equals(type)) {
            var school = entry.field("school");
            if (notBlank(school)) {
                return school;
            }
        }
        if ("report".equals(type)) {
            var institution = entry.field("institution");
            if (notBlank(institution)) {
                return institution;
            }
        }
        var organization = entry.field("organization");
        if (notBlank(organization)) {
            return organization;
        }
        var institution = entry.field("institution");
        return notBlank(institution) ? institution : null;
    }

    private String citationLabel() {
        var family = firstAuthorFamily().replaceAll("\\s+", "");
        var year = year();
        if (family.isEmpty() && year.isEmpty()) {
            return null;
        }
        var shortYear = year.length() == 4 ? year.substring(2) : year;
        var label = family.length() > 4 ? family.substring(0, 4) : family;
        return label.isEmpty() ? shortYear : capitalize(label) + shortYear;
    }

    private static String capitalize(String value) {
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
