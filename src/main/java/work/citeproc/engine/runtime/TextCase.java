package work.citeproc.engine.runtime;

import java.util.Locale;
import java.util.Set;

/**
 * {@code text-case} transformations on plain text.
 */
final class TextCase {
    private static final Set<String> MINOR_WORDS = Set.of(
        "a", "an", "and", "as", "at", "but", "by", "down", "for", "from", "in", "into", "nor", "of", "on", "onto",
        "or", "over", "so", "the", "till", "to", "up", "via", "with", "yet"
    );

    private TextCase() {}

    /**
     * @param first whether {@code value} starts the rendered element (sentence and title case capitalise it)
     */
    static String apply(String mode, String value, boolean first) {
        if (mode == null || value.isEmpty()) {
            return value;
        }
        return switch (mode) {
            case "lowercase" -> value.toLowerCase(Locale.ROOT);
            case "uppercase" -> value.toUpperCase(Locale.ROOT);
            case "capitalize-first" -> first ? capitalize(value) : value;
            case "capitalize-all" -> capitalizeAll(value);
            case "sentence" -> sentence(value, first);
            case "title" -> title(value, first);
            default -> value;
        };
    }

    static String capitalize(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isLetter(value.charAt(i))) {
                return value.substring(0, i) + Character.toUpperCase(value.charAt(i)) + value.substring(i + 1);
            }
        }
        return value;
    }

    private static String capitalizeAll(String value) {
        var words = value.split(" ", -1);
        for (int i = 0; i < words.length; i++) {
            words[i] = capitalize(words[i]);
        }
        return String.join(" ", words);
    }

    private static String sentence(String value, boolean first) {
        var words = value.split(" ", -1);
        for (int i = 0; i < words.length; i++) {
            if (isAllCaps(words[i])) {
                words[i] = words[i].toLowerCase(Locale.ROOT);
            }
        }
        var joined = String.join(" ", words);
        return first ? capitalize(joined) : joined;
    }

    private static String title(String value, boolean first) {
        var words = value.split(" ", -1);
        boolean leading = first;
        for (int i = 0; i < words.length; i++) {
            var word = words[i];
            if (word.isEmpty()) {
                continue;
            }
            if (leading || !MINOR_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                words[i] = hasInnerCapital(word) ? word : capitalize(word);
            } else {
                words[i] = word.toLowerCase(Locale.ROOT);
            }
            leading = word.endsWith(":");
        }
        return String.join(" ", words);
    }

    private static boolean isAllCaps(String word) {
        boolean letters = false;
        for (char c : word.toCharArray()) {
            if (Character.isLetter(c)) {
                letters = true;
                if (Character.isLowerCase(c)) {
                    return false;
                }
            }
        }
        return letters && word.length() > 1;
    }

    // words such as "iPhone" or "McDonald" keep their casing
    private static boolean hasInnerCapital(String word) {
        for (int i = 1; i < word.length(); i++) {
            if (Character.isUpperCase(word.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
