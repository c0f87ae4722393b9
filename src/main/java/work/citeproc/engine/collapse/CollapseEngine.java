package work.citeproc.engine.collapse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import work.citeproc.engine.locale.LocaleResolver;
import work.citeproc.engine.locale.TermForm;
import work.citeproc.engine.output.Output;
import work.citeproc.engine.style.Style;

/**
 * Joins the cites of one cluster, collapsing numeric runs into ranges and same-author cites into year lists.
 */
public final class CollapseEngine {
    private static final int MIN_RANGE = 3;

    private final Style style;
    private final LocaleResolver locale;

    public CollapseEngine(Style style, LocaleResolver locale) {
        this.style = style;
        this.locale = locale;
    }

    /**
     * @param cites rendered cites in cluster order
     * @return the cluster body, without the layout's affixes and formatting
     */
    public Output collapse(List<RenderedCite> cites) {
        var citation = style.citation();
        var delimiter = citation.layoutFor(null).attr("delimiter", "");
        var mode = citation.option("collapse", "");
        if ("citation-number".equals(mode)) {
            return collapseNumbers(cites, delimiter);
        }
        boolean yearMode = mode.startsWith("year");
        var groupDelimiter = citation.option("cite-group-delimiter");
        if (!yearMode && groupDelimiter == null) {
            var parts = new ArrayList<Output>();
            for (var cite : cites) {
                parts.add(cite.full());
            }
            return Output.join(parts, delimiter);
        }
        if (mode.startsWith("year-suffix") && !"true".equals(inherited("disambiguate-add-year-suffix"))) {
            mode = "year";
        }
        return collapseAuthors(group(cites), mode, delimiter, groupDelimiter == null ? ", " : groupDelimiter);
    }

    Output collapseNumbers(List<RenderedCite> cites, String delimiter) {
        var rangeDelimiter = rangeDelimiter();
        var parts = new ArrayList<Output>();
        int i = 0;
        while (i < cites.size()) {
            var cite = cites.get(i);
            int end = i;
            if (cite.isBareNumber()) {
                while (end + 1 < cites.size() && cites.get(end + 1).isBareNumber()
                    && cites.get(end + 1).citationNumber() == cites.get(end).citationNumber() + 1) {
                    end++;
                }
            }
            if (end - i + 1 >= MIN_RANGE) {
                parts.add(Output.seq(cite.full(), Output.text(rangeDelimiter), cites.get(end).full()));
                i = end + 1;
            } else {
                parts.add(cite.full());
                i++;
            }
        }
        return Output.join(parts, delimiter);
    }

    /**
     * Moves cites with the same author key next to the first cite of that author, keeping relative order.
     */
    static List<List<RenderedCite>> group(List<RenderedCite> cites) {
        var groups = new LinkedHashMap<String, List<RenderedCite>>();
        int anonymous = 0;
        for (var cite : cites) {
            var key = cite.authorKey() == null || cite.authorKey().isEmpty()
                ? "\u0000" + anonymous++
                : cite.authorKey();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(cite);
        }
        return new ArrayList<>(groups.values());
    }

    private Output collapseAuthors(List<List<RenderedCite>> groups, String mode, String delimiter, String groupDelimiter) {
        var afterCollapse = style.citation().option("after-collapse-delimiter", delimiter);
        var result = new ArrayList<Output>();
        boolean previousCollapsed = false;
        for (var group : groups) {
            if (!result.isEmpty()) {
                result.add(Output.text(previousCollapsed ? afterCollapse : delimiter));
            }
            boolean collapsed = !mode.isEmpty() && group.size() > 1;
            result.add(collapsed ? collapseGroup(group, mode, groupDelimiter, delimiter) : joinGroup(group, groupDelimiter));
            previousCollapsed = collapsed;
        }
        return Output.seq(result);
    }

    private static Output joinGroup(List<RenderedCite> group, String groupDelimiter) {
        var parts = new ArrayList<Output>();
        for (var cite : group) {
            parts.add(cite.full());
        }
        return Output.join(parts, groupDelimiter);
    }

    private Output collapseGroup(List<RenderedCite> group, String mode, String groupDelimiter, String delimiter) {
        var suffixDelimiter = style.citation().option("year-suffix-delimiter", delimiter);
        var parts = new ArrayList<Output>();
        parts.add(group.get(0).full());
        int i = 1;
        boolean mergeSuffixes = mode.startsWith("year-suffix");
        while (i < group.size()) {
            var cite = group.get(i);
            var previous = group.get(i - 1);
            if (mergeSuffixes && sameYearRun(previous, cite)) {
                int end = i;
                while (end + 1 < group.size() && sameYearRun(group.get(end), group.get(end + 1))) {
                    end++;
                }
                parts.add(suffixes(group, i - 1, end, "year-suffix-ranged".equals(mode), suffixDelimiter));
                i = end + 1;
                continue;
            }
            parts.add(Output.text(groupDelimiter));
            parts.add(cite.withoutAuthor());
            i++;
        }
        return Output.seq(parts);
    }

    /**
     * Letters of cites {@code from+1..to}; {@code from} has already been rendered in full.
     */
    private Output suffixes(List<RenderedCite> group, int from, int to, boolean ranged, String suffixDelimiter) {
        if (ranged && to - from + 1 >= MIN_RANGE && consecutiveLetters(group, from, to)) {
            return Output.text(rangeDelimiter() + group.get(to).yearSuffix());
        }
        var parts = new ArrayList<Output>();
        for (int i = from + 1; i <= to; i++) {
            parts.add(Output.text(suffixDelimiter + group.get(i).yearSuffix()));
        }
        return Output.seq(parts);
    }

    private static boolean consecutiveLetters(List<RenderedCite> group, int from, int to) {
        for (int i = from + 1; i <= to; i++) {
            if (group.get(i).yearSuffix() != group.get(i - 1).yearSuffix() + 1) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameYearRun(RenderedCite previous, RenderedCite next) {
        return previous.yearSuffix() != null && next.yearSuffix() != null
            && previous.year() != null && previous.year().equals(next.year())
            && !previous.item().hasLocator() && !next.item().hasLocator();
    }

    private String rangeDelimiter() {
        var term = locale.term("citation-range-delimiter", TermForm.LONG, false);
        return term.isEmpty() ? "-" : term;
    }

    private String inherited(String option) {
        var value = style.citation().option(option);
        return value != null ? value : style.option(option);
    }
}
