package work.citeproc.engine.output;

/**
 * Punctuation collapsing at affix and delimiter boundaries.
 */
public final class Punctuation {
    private Punctuation() {}

    /**
     * Drops the first character of {@code next} when it repeats the terminal punctuation of {@code previous}.
     */
    public static String trimLeadingDuplicate(String previous, String next) {
        if (previous == null || previous.isEmpty() || next == null || next.isEmpty()) {
            return next;
        }
        char last = previous.charAt(previous.length() - 1);
        char first = next.charAt(0);
        if (isCollapsible(first) && (first == last || (first == '.' && (last == '?' || last == '!')))) {
            return next.substring(1);
        }
        return next;
    }

    public static boolean isCollapsible(char c) {
        return c == '.' || c == ',' || c == ';' || c == ':';
    }
}
