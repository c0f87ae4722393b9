package work.citeproc.engine.style;

import java.util.Locale;

public enum StyleClass {
    IN_TEXT,
    NOTE;

    public static StyleClass from(String value) {
        if (value == null || value.isBlank()) {
            return IN_TEXT;
        }
        return "note".equals(value.trim().toLowerCase(Locale.ROOT)) ? NOTE : IN_TEXT;
    }
}
