package work.citeproc.engine.disambiguation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.citeproc.engine.data.Entry;
import work.citeproc.engine.data.VariableAccessor;
import work.citeproc.engine.locale.LocaleResolver;
import work.citeproc.engine.runtime.Interpreter;
import work.citeproc.engine.runtime.NameFormatter;
import work.citeproc.engine.runtime.RenderContext;
import work.citeproc.engine.runtime.RenderTarget;
import work.citeproc.engine.style.Style;

/**
 * Assigns year-suffixes and expands names until no two cited entries render the same short citation.
 * Works on the whole cited set in bibliography order; states only ever grow.
 */
public final class DisambiguationEngine {
    private static final Logger log = LogManager.getLogger(DisambiguationEngine.class);

    public static final int DEFAULT_MAX_ITERATIONS = 10;
    private static final int MAX_SUFFIXES = 26;

    private final Style style;
    private final LocaleResolver locale;
    private final int maxIterations;

    public DisambiguationEngine(Style style, LocaleResolver locale) {
        this(style, locale, DEFAULT_MAX_ITERATIONS);
    }

    public DisambiguationEngine(Style style, LocaleResolver locale, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive but was " + maxIterations);
        }
        this.style = style;
        this.locale = locale;
        this.maxIterations = maxIterations;
    }

    /**
     * Updates {@code states} in place. Entries without a state start from {@link DisambiguationState#INITIAL}.
     *
     * @param sorted cited entries in bibliography order
     */
    public DisambiguationOutcome run(List<Entry> sorted, Map<String, DisambiguationState> states) {
        for (var entry : sorted) {
            states.putIfAbsent(entry.id(), DisambiguationState.INITIAL);
        }
        if (enabled("disambiguate-add-year-suffix")) {
            assignYearSuffixes(sorted, states);
        }
        DisambiguationOutcome outcome = new DisambiguationOutcome.Converged(0);
        boolean givenname = enabled("disambiguate-add-givenname");
        boolean names = enabled("disambiguate-add-names");
        if (givenname || names) {
            outcome = expandNames(sorted, states, givenname, names);
        }
        if (style.usesDisambiguateCondition()) {
            flagRemainingCollisions(sorted, states);
        }
        if (outcome instanceof DisambiguationOutcome.CappedAt capped) {
            log.warn("Disambiguation stopped after {} iterations with collisions left", capped.cap());
        }
        return outcome;
    }

    private boolean enabled(String option) {
        var value = style.citation().option(option);
        return "true".equals(value != null ? value : style.option(option));
    }

    void assignYearSuffixes(List<Entry> sorted, Map<String, DisambiguationState> states) {
        var groups = new LinkedHashMap<String, List<Entry>>();
        for (var entry : sorted) {
            var accessor = new VariableAccessor(entry, Map.of());
            var key = accessor.firstAuthorFamily().toLowerCase(Locale.ROOT) + "\u0000" + accessor.year();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
        }
        for (var group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            if (group.size() > MAX_SUFFIXES) {
                log.warn("{} entries share author and year; only the first {} get a year-suffix",
                    group.size(), MAX_SUFFIXES);
            }
            for (int i = 0; i < group.size() && i < MAX_SUFFIXES; i++) {
                var id = group.get(i).id();
                states.put(id, states.get(id).withYearSuffix((char) ('a' + i)));
            }
        }
    }

    private DisambiguationOutcome expandNames(List<Entry> sorted, Map<String, DisambiguationState> states,
                                              boolean givenname, boolean names) {
        int givennameCap = givennameCap();
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            boolean changed = false;
            for (var group : collisions(sorted, states, false)) {
                for (var entry : group) {
                    var state = states.get(entry.id());
                    if (givenname && state.givennameLevel() < givennameCap) {
                        states.put(entry.id(), state.withGivennameLevel(state.givennameLevel() + 1));
                        changed = true;
                    } else if (names && hasHiddenNames(entry, state)) {
                        states.put(entry.id(), state.withNamesExpanded(state.namesExpanded() + 1));
                        changed = true;
                    }
                }
            }
            if (!changed) {
                log.debug("Name disambiguation converged after {} iteration(s)", iteration);
                return new DisambiguationOutcome.Converged(iteration);
            }
        }
        return new DisambiguationOutcome.CappedAt(maxIterations);
    }

    private int givennameCap() {
        var rule = style.citation().option("givenname-disambiguation-rule", "by-cite");
        return rule.endsWith("-with-initials") ? 1 : DisambiguationState.MAX_GIVENNAME_LEVEL;
    }

    private void flagRemainingCollisions(List<Entry> sorted, Map<String, DisambiguationState> states) {
        for (var group : collisions(sorted, states, true)) {
            for (var entry : group) {
                states.put(entry.id(), states.get(entry.id()).withDisambiguateCondition());
            }
        }
    }

    /**
     * Groups of entries sharing short key and year.
     */
    List<List<Entry>> collisions(List<Entry> sorted, Map<String, DisambiguationState> states, boolean withSuffix) {
        var groups = new LinkedHashMap<String, List<Entry>>();
        for (var entry : sorted) {
            var state = states.get(entry.id());
            var year = new VariableAccessor(entry, Map.of()).year();
            var key = shortKey(entry, state) + "\u0000" + year + (withSuffix ? state.yearSuffixText() : "");
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
        }
        var colliding = new ArrayList<List<Entry>>();
        for (var group : groups.values()) {
            if (group.size() > 1) {
                colliding.add(group);
            }
        }
        return colliding;
    }

    /**
     * Rendered first {@code <names>} of the citation layout under the given state.
     */
    public String shortKey(Entry entry, DisambiguationState state) {
        var layout = style.citation().layoutFor(entry.language());
        var names = style.firstNames(layout);
        if (names.isEmpty()) {
            return "";
        }
        var ctx = RenderContext.builder(style, entry, locale)
            .target(RenderTarget.CITATION)
            .state(state.withYearSuffix(null))
            .build();
        return Interpreter.renderNode(names.get(), ctx).plainText();
    }

    private boolean hasHiddenNames(Entry entry, DisambiguationState state) {
        var layout = style.citation().layoutFor(entry.language());
        var names = style.firstNames(layout);
        if (names.isEmpty()) {
            return false;
        }
        int longest = 0;
        for (var variable : NameFormatter.variables(names.get())) {
            longest = Math.max(longest, entry.names(variable).size());
        }
        var ctx = RenderContext.builder(style, entry, locale)
            .target(RenderTarget.CITATION)
            .state(state)
            .build();
        return NameFormatter.shownNames(names.get(), longest, ctx) < longest;
    }
}
