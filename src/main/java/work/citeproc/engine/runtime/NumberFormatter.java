package work.citeproc.engine.runtime;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.citeproc.engine.locale.LocaleResolver;

/**
 * Number forms ({@code numeric}, {@code ordinal}, {@code long-ordinal}, {@code roman}) and page-range formats.
 */
public final class NumberFormatter {
    private static final Logger log = LogManager.getLogger(NumberFormatter.class);

    private static final Pattern NUMERIC = Pattern.compile(
        "\\s*[A-Za-z]?\\d+[A-Za-z]*(\\s*(?:[-–,&]|and)\\s*[A-Za-z]?\\d+[A-Za-z]*)*\\s*");
    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern RANGE = Pattern.compile("(\\d+)\\s*[-–]\\s*(\\d+)");
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);
    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_DIGITS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};

    private NumberFormatter() {}

    /**
     * CSL numeric test used by {@code <number>} and labels: digit groups, optionally affixed with letters, joined
     * by hyphens, commas or ampersands.
     */
    public static boolean isNumeric(String value) {
        return value != null && NUMERIC.matcher(value).matches();
    }

    /**
     * Whether {@code value} holds more than one number, as used by {@code is-multiple} and plural labels.
     */
    public static boolean isMultiple(String value) {
        if (value == null) {
            return false;
        }
        var matcher = INTEGER.matcher(value);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count > 1;
    }

    public static String ordinal(int number, LocaleResolver locale, String genderForm) {
        return locale.ordinal(number, genderForm);
    }

    public static String longOrdinal(int number, LocaleResolver locale, String genderForm) {
        return locale.longOrdinal(number, genderForm);
    }

    public static String roman(int number) {
        if (number <= 0 || number >= 4000) {
            return Integer.toString(number);
        }
        var builder = new StringBuilder();
        int remaining = number;
        for (int i = 0; i < ROMAN_VALUES.length; i++) {
            while (remaining >= ROMAN_VALUES[i]) {
                builder.append(ROMAN_DIGITS[i]);
                remaining -= ROMAN_VALUES[i];
            }
        }
        return builder.toString();
    }

    /**
     * Renders every integer inside {@code raw} in the given form. Non-numeric input is returned unchanged.
     */
    public static String format(String raw, String form, LocaleResolver locale, String genderForm) {
        if (raw == null) {
            return "";
        }
        if (!isNumeric(raw)) {
            log.debug("Rendering non-numeric value '{}' as is", raw);
            return raw;
        }
        var matcher = INTEGER.matcher(raw);
        var builder = new StringBuilder();
        while (matcher.find()) {
            int number;
            try {
                number = Integer.parseInt(matcher.group());
            } catch (NumberFormatException ex) {
                log.debug("Number '{}' out of range, rendering as is", matcher.group());
                return raw;
            }
            var rendered = switch (form == null ? "numeric" : form) {
                case "ordinal" -> ordinal(number, locale, genderForm);
                case "long-ordinal" -> longOrdinal(number, locale, genderForm);
                case "roman" -> roman(number);
                default -> Integer.toString(number);
            };
            matcher.appendReplacement(builder, Matcher.quoteReplacement(rendered));
        }
        matcher.appendTail(builder);
        return normalizeRangeDelimiters(builder.toString());
    }

    /**
     * Reformats every page range in {@code value}. A {@code null} format leaves ranges as supplied.
     */
    public static String pageRange(String value, String format, String delimiter) {
        if (value == null || format == null) {
            return value;
        }
        var dash = delimiter == null || delimiter.isEmpty() ? "–" : delimiter;
        var matcher = RANGE.matcher(value);
        var builder = new StringBuilder();
        while (matcher.find()) {
            var first = matcher.group(1);
            var last = expand(first, matcher.group(2));
            var rendered = first + dash + collapse(first, last, format);
            matcher.appendReplacement(builder, Matcher.quoteReplacement(rendered));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    static String expand(String first, String last) {
        if (last.length() >= first.length()) {
            return last;
        }
        return first.substring(0, first.length() - last.length()) + last;
    }

    private static String collapse(String first, String last, String format) {
        if (first.length() != last.length()) {
            return last;
        }
        return switch (format.toLowerCase(Locale.ROOT)) {
            case "minimal" -> minimal(first, last, 1);
            case "minimal-two" -> minimal(first, last, 2);
            case "chicago" -> chicago(first, last);
            default -> last;
        };
    }

    private static String minimal(String first, String last, int keep) {
        int common = 0;
        while (common < first.length() && first.charAt(common) == last.charAt(common)) {
            common++;
        }
        int digits = Math.max(last.length() - common, Math.min(keep, last.length()));
        return last.substring(last.length() - digits);
    }

    private static String chicago(String first, String last) {
        var start = new BigInteger(first);
        int lastTwo = start.mod(HUNDRED).intValue();
        if (start.compareTo(HUNDRED) < 0 || lastTwo == 0) {
            return last;
        }
        if (lastTwo < 10) {
            return minimal(first, last, 1);
        }
        var shortened = minimal(first, last, 2);
        if (first.length() == 4 && shortened.length() >= 3) {
            return last;
        }
        return shortened;
    }

    private static String normalizeRangeDelimiters(String value) {
        return value.replaceAll("\\s*&\\s*", " & ").replaceAll("\\s*,\\s*", ", ");
    }
}
