package work.citeproc.engine.runtime;

/**
 * Parsed date variable: a single date or a range, possibly uncertain, or an unparsed literal.
 *
 * @param end {@code null} unless the value is a range
 * @param literal raw text for values that are not structured dates, otherwise {@code null}
 */
public record DateValue(Parts start, Parts end, boolean uncertain, String literal) {
    public static DateValue literal(String text) {
        return new DateValue(null, null, false, text);
    }

    public boolean isLiteral() {
        return literal != null;
    }

    public boolean isRange() {
        return end != null && !end.equals(start);
    }

    /**
     * Year, month and day of one date. Zero marks an absent part; months 21-24 are the four seasons.
     */
    public record Parts(int year, int month, int day) {
        public boolean hasMonth() {
            return month >= 1 && month <= 12;
        }

        public boolean hasSeason() {
            return month >= 21 && month <= 24;
        }

        public int season() {
            return hasSeason() ? month - 20 : 0;
        }

        public boolean hasDay() {
            return day > 0 && hasMonth();
        }
    }
}
