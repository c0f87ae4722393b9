package work.citeproc.engine.runtime;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the {@code -}-delimited date strings produced by the entry loaders ({@code 2020-05-12},
 * {@code 2020-05/2020-07}, {@code ~1850}, {@code 2019-21} for spring).
 */
public final class DateParser {
    private static final Pattern DATE = Pattern.compile("(-?\\d{1,4})(?:-(\\d{1,2}))?(?:-(\\d{1,2}))?");
    private static final List<String> UNCERTAIN_MARKERS = List.of("circa", "c.", "~", "?", "ca.", "approximately");

    private DateParser() {}

    /**
     * @return the parsed date, a literal date for unstructured text, or empty for blank input
     */
    public static Optional<DateValue> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var text = raw.trim();
        boolean uncertain = isUncertain(text);
        var cleaned = text.replace("~", "").replace("?", "")
            .replaceFirst("(?i)^(circa|approximately|ca\\.|c\\.)\\s*", "").trim();
        var halves = cleaned.split("/", -1);
        if (halves.length > 2) {
            return Optional.of(DateValue.literal(text));
        }
        var start = parts(halves[0].trim());
        if (start == null) {
            return Optional.of(DateValue.literal(text));
        }
        DateValue.Parts end = null;
        if (halves.length == 2 && !halves[1].isBlank()) {
            end = parts(halves[1].trim());
            if (end == null) {
                return Optional.of(DateValue.literal(text));
            }
        }
        return Optional.of(new DateValue(start, end, uncertain, null));
    }

    public static boolean isUncertain(String raw) {
        if (raw == null) {
            return false;
        }
        var lower = raw.toLowerCase(Locale.ROOT);
        for (var marker : UNCERTAIN_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static DateValue.Parts parts(String text) {
        var matcher = DATE.matcher(text);
        if (!matcher.matches()) {
            return null;
        }
        int year = Integer.parseInt(matcher.group(1));
        int month = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
        int day = matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3));
        if (month >= 13 && month <= 16) {
            month += 8;
        }
        if (month < 0 || (month > 12 && month < 21) || month > 24 || day < 0 || day > 31) {
            return null;
        }
        return new DateValue.Parts(year, month, day);
    }
}
