package work.citeproc.engine.data;

import java.util.Locale;

/**
 * Position class of a cite relative to earlier cites of the same item.
 */
public enum Position {
    FIRST,
    SUBSEQUENT,
    IBID,
    IBID_WITH_LOCATOR;

    public static Position from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Position.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
