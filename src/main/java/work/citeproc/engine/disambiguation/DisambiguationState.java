package work.citeproc.engine.disambiguation;

/**
 * Per-entry disambiguation snapshot. Every field only ever grows across iterations.
 *
 * @param yearSuffix letter {@code a..z}, or {@code null} when none is assigned
 * @param namesExpanded names shown beyond the et-al cut-off
 * @param givennameLevel 0 = as styled, 1 = initials, 2 = full given names
 * @param disambiguateCondition whether {@code disambiguate="true"} conditions hold for this entry
 */
public record DisambiguationState(Character yearSuffix, int namesExpanded, int givennameLevel, boolean disambiguateCondition) {
    public static final DisambiguationState INITIAL = new DisambiguationState(null, 0, 0, false);
    public static final int MAX_GIVENNAME_LEVEL = 2;

    public DisambiguationState {
        if (givennameLevel < 0 || givennameLevel > MAX_GIVENNAME_LEVEL) {
            throw new IllegalArgumentException("givennameLevel must be within 0..2 but was " + givennameLevel);
        }
        if (namesExpanded < 0) {
            throw new IllegalArgumentException("namesExpanded must not be negative");
        }
        if (yearSuffix != null && (yearSuffix < 'a' || yearSuffix > 'z')) {
            throw new IllegalArgumentException("yearSuffix must be within a..z but was " + yearSuffix);
        }
    }

    public DisambiguationState withYearSuffix(Character suffix) {
        return new DisambiguationState(suffix, namesExpanded, givennameLevel, disambiguateCondition);
    }

    public DisambiguationState withNamesExpanded(int expanded) {
        return new DisambiguationState(yearSuffix, Math.max(namesExpanded, expanded), givennameLevel, disambiguateCondition);
    }

    public DisambiguationState withGivennameLevel(int level) {
        return new DisambiguationState(yearSuffix, namesExpanded, Math.max(givennameLevel, level), disambiguateCondition);
    }

    public DisambiguationState withDisambiguateCondition() {
        return new DisambiguationState(yearSuffix, namesExpanded, givennameLevel, true);
    }

    public String yearSuffixText() {
        return yearSuffix == null ? "" : String.valueOf(yearSuffix);
    }
}
