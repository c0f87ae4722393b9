package work.citeproc.engine.locale;

import java.util.List;
import java.util.Locale;

/**
 * Term forms with the CSL fallback order: verb-short to verb to long, symbol to short to long, short to long.
 */
public enum TermForm {
    LONG("long"),
    SHORT("short"),
    VERB("verb"),
    VERB_SHORT("verb-short"),
    SYMBOL("symbol");

    private final String attribute;

    TermForm(String attribute) {
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }

    public List<TermForm> fallbacks() {
        return switch (this) {
            case LONG -> List.of(LONG);
            case SHORT -> List.of(SHORT, LONG);
            case VERB -> List.of(VERB, LONG);
            case VERB_SHORT -> List.of(VERB_SHORT, VERB, LONG);
            case SYMBOL -> List.of(SYMBOL, SHORT, LONG);
        };
    }

    public static TermForm from(String value) {
        if (value == null || value.isBlank()) {
            return LONG;
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var form : values()) {
            if (form.attribute.equals(normalized)) {
                return form;
            }
        }
        return LONG;
    }
}
