package work.citeproc.engine.api;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.citeproc.engine.collapse.CollapseEngine;
import work.citeproc.engine.collapse.RenderedCite;
import work.citeproc.engine.data.CitationOccurrence;
import work.citeproc.engine.data.CiteItem;
import work.citeproc.engine.data.Entry;
import work.citeproc.engine.data.Position;
import work.citeproc.engine.data.VariableAccessor;
import work.citeproc.engine.disambiguation.DisambiguationEngine;
import work.citeproc.engine.disambiguation.DisambiguationState;
import work.citeproc.engine.locale.LocaleResolver;
import work.citeproc.engine.output.Output;
import work.citeproc.engine.output.OutputFormat;
import work.citeproc.engine.runtime.Decorations;
import work.citeproc.engine.runtime.Interpreter;
import work.citeproc.engine.runtime.RenderContext;
import work.citeproc.engine.runtime.RenderTarget;
import work.citeproc.engine.sort.SortEngine;
import work.citeproc.engine.style.Definition;
import work.citeproc.engine.style.Style;

/**
 * Renders the citations and bibliography of one document. Collects citations, then runs positions, sorting,
 * numbering and disambiguation before any output is produced.
 */
public final class EngineSession {
    private static final Logger log = LogManager.getLogger(EngineSession.class);

    private final Style style;
    private final LocaleResolver locale;
    private final Map<String, Entry> entries;
    private final List<CitationOccurrence> citations = new ArrayList<>();
    private final OutputFormat format;
    private final boolean memoizeMacros;
    private final int nearNoteDistance;
    private final int maxIterations;

    private EngineSession(Builder builder) {
        this.style = Objects.requireNonNull(builder.style, "style");
        this.locale = builder.locale != null ? builder.locale : LocaleResolver.of(
            builder.language != null ? builder.language : style.defaultLocale(), style.locales(), List.of());
        this.entries = new LinkedHashMap<>();
        for (var entry : builder.entries) {
            if (entries.putIfAbsent(entry.id(), entry) != null) {
                log.warn("Duplicate entry id '{}', keeping the first one", entry.id());
            }
        }
        this.format = builder.format;
        this.memoizeMacros = builder.memoizeMacros;
        this.nearNoteDistance = builder.nearNoteDistance;
        this.maxIterations = builder.maxIterations;
    }

    public static Builder builder(Style style) {
        return new Builder(style);
    }

    public void cite(CitationOccurrence occurrence) {
        citations.add(Objects.requireNonNull(occurrence, "occurrence"));
    }

    public void citeAll(List<CitationOccurrence> occurrences) {
        occurrences.forEach(this::cite);
    }

    public LocaleResolver locale() {
        return locale;
    }

    /**
     * Without citations every entry counts as cited, in input order.
     */
    public SessionResult render() {
        var warnings = new ArrayList<String>();
        var citeOrder = citeOrder(warnings);
        var cited = new ArrayList<Entry>();
        citeOrder.keySet().forEach(id -> cited.add(entries.get(id)));

        var sorted = new SortEngine(style, locale).sortBibliography(cited, citeOrder);
        var numbers = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < sorted.size(); i++) {
            numbers.put(sorted.get(i).id(), i + 1);
        }

        var states = new LinkedHashMap<String, DisambiguationState>();
        var outcome = new DisambiguationEngine(style, locale, maxIterations).run(sorted, states);
        log.debug("Disambiguated {} entries: {}", sorted.size(), outcome);

        var bibliography = new ArrayList<BibliographyItem>();
        var bibliographyFormat = BibliographyFormat.DEFAULT;
        var definition = style.bibliography().orElse(null);
        if (definition != null) {
            bibliography.addAll(renderBibliography(definition, sorted, numbers, states, warnings));
            bibliographyFormat = BibliographyFormat.from(definition);
        }
        var rendered = renderCitations(numbers, states, warnings);
        return new SessionResult(rendered, bibliography, bibliographyFormat, outcome, states, warnings);
    }

    private Map<String, Integer> citeOrder(List<String> warnings) {
        var order = new LinkedHashMap<String, Integer>();
        if (citations.isEmpty()) {
            entries.keySet().forEach(id -> order.put(id, order.size()));
            return order;
        }
        for (var occurrence : citations) {
            for (var item : occurrence.items()) {
                if (entries.containsKey(item.id())) {
                    order.putIfAbsent(item.id(), order.size());
                } else {
                    warnOnce(warnings, "Unknown entry id '" + item.id() + "' cited");
                }
            }
        }
        return order;
    }

    private List<BibliographyItem> renderBibliography(Definition definition, List<Entry> sorted,
                                                      Map<String, Integer> numbers,
                                                      Map<String, DisambiguationState> states,
                                                      List<String> warnings) {
        var substitute = definition.option("subsequent-author-substitute");
        var items = new ArrayList<BibliographyItem>();
        String previousAuthor = null;
        for (var entry : sorted) {
            var layout = definition.layoutFor(entry.language());
            int number = numbers.get(entry.id());
            var state = states.get(entry.id());
            var ctx = bibliographyContext(entry, state, number, warnings);
            var output = Interpreter.renderLayout(layout, ctx.build());
            var withoutNumber = Interpreter.renderLayout(layout,
                bibliographyContext(entry, state, null, warnings).build());
            if (substitute != null) {
                var names = style.firstNames(layout);
                var author = names.isEmpty() ? ""
                    : Interpreter.renderNode(names.get(), ctx.build()).plainText();
                // every rule behaves like complete-all
                if (!author.isEmpty() && author.equals(previousAuthor)) {
                    output = Interpreter.renderLayout(layout, ctx.replaceFirstNames(substitute).build());
                    withoutNumber = Interpreter.renderLayout(layout,
                        bibliographyContext(entry, state, null, warnings).replaceFirstNames(substitute).build());
                }
                previousAuthor = author;
            }
            items.add(new BibliographyItem(entry.id(), format.render(output), format.render(withoutNumber), number));
        }
        return items;
    }

    private RenderContext.Builder bibliographyContext(Entry entry, DisambiguationState state, Integer number,
                                                      List<String> warnings) {
        var builder = RenderContext.builder(style, entry, locale)
            .target(RenderTarget.BIBLIOGRAPHY)
            .state(state)
            .memoizeMacros(memoizeMacros)
            .warnings(warnings);
        if (number != null) {
            builder.citationNumber(number);
        }
        return builder;
    }

    private List<RenderedCitation> renderCitations(Map<String, Integer> numbers,
                                                   Map<String, DisambiguationState> states,
                                                   List<String> warnings) {
        var placed = placeCites();
        var sortEngine = new SortEngine(style, locale);
        var collapseEngine = new CollapseEngine(style, locale);
        var rendered = new ArrayList<RenderedCitation>();
        int index = 0;
        for (var occurrence : citations) {
            index++;
            var citationId = occurrence.citationId() != null ? occurrence.citationId() : "CITATION-" + index;
            var known = new ArrayList<CiteItem>();
            for (var item : occurrence.items()) {
                if (entries.containsKey(item.id())) {
                    known.add(item);
                }
            }
            var ordered = sortEngine.sortCluster(known, entries, numbers);
            var cites = new ArrayList<RenderedCite>();
            RenderContext first = null;
            for (var item : ordered) {
                var placement = placed.get(item);
                var builder = citationContext(item, occurrence, placement, numbers, states, warnings);
                var ctx = builder.build();
                if (first == null) {
                    first = ctx;
                }
                cites.add(renderCite(item, builder, ctx, numbers, states));
            }
            var body = collapseEngine.collapse(cites);
            var text = "";
            if (first != null) {
                var layout = style.citation().layoutFor(null);
                text = format.render(Decorations.apply(layout.attributes(), body, first));
            }
            var ids = new ArrayList<String>();
            ordered.forEach(item -> ids.add(item.id()));
            rendered.add(new RenderedCitation(citationId, text, occurrence.noteNumber(), ids));
        }
        return rendered;
    }

    private RenderedCite renderCite(CiteItem item, RenderContext.Builder builder, RenderContext ctx,
                                    Map<String, Integer> numbers, Map<String, DisambiguationState> states) {
        var entry = entries.get(item.id());
        var layout = style.citation().layoutFor(entry.language());
        var names = style.firstNames(layout);
        Output full;
        if (item.authorOnly()) {
            full = names.map(node -> Interpreter.renderNode(node, ctx)).orElse(Output.EMPTY);
        } else if (item.suppressAuthor()) {
            full = Interpreter.renderLayout(layout, builder.suppressAuthor(true).build());
            builder.suppressAuthor(false);
        } else {
            full = Interpreter.renderLayout(layout, ctx);
        }
        full = Output.seq(Output.text(item.prefix()), full, Output.text(item.suffix()));
        var withoutAuthor = Interpreter.renderLayout(layout, builder.suppressAuthor(true).build());
        builder.suppressAuthor(false);
        var authorKey = names.map(node -> Interpreter.renderNode(node, builder.build()).plainText()).orElse("");
        var state = states.get(entry.id());
        return new RenderedCite(item, full, Output.seq(withoutAuthor, Output.text(item.suffix())), authorKey,
            numbers.get(entry.id()), new VariableAccessor(entry, Map.of()).year(), state.yearSuffix());
    }

    private RenderContext.Builder citationContext(CiteItem item, CitationOccurrence occurrence, Placement placement,
                                                  Map<String, Integer> numbers,
                                                  Map<String, DisambiguationState> states,
                                                  List<String> warnings) {
        var entry = entries.get(item.id());
        return RenderContext.builder(style, entry, locale)
            .target(RenderTarget.CITATION)
            .state(states.get(entry.id()))
            .item(item)
            .position(placement.position())
            .noteNumber(occurrence.noteNumber())
            .previousNoteNumber(placement.previousNote())
            .firstReferenceNoteNumber(placement.firstNote())
            .citationNumber(numbers.get(entry.id()))
            .nearNoteDistance(nearNoteDistance)
            .memoizeMacros(memoizeMacros)
            .warnings(warnings);
    }

    /**
     * Positions in document order. A position supplied with the occurrence wins over the computed one.
     */
    Map<CiteItem, Placement> placeCites() {
        var placements = new IdentityHashMap<CiteItem, Placement>();
        var seen = new HashSet<String>();
        var lastNote = new LinkedHashMap<String, Integer>();
        var firstNote = new LinkedHashMap<String, Integer>();
        CiteItem previous = null;
        int previousSize = 0;
        for (var occurrence : citations) {
            var items = occurrence.items();
            for (int i = 0; i < items.size(); i++) {
                var item = items.get(i);
                // the first cite of a citation only follows up a citation holding a single cite
                var preceding = i > 0 || previousSize == 1 ? previous : null;
                var position = occurrence.position() != null
                    ? occurrence.position()
                    : computePosition(item, preceding, seen);
                placements.put(item, new Placement(position, lastNote.get(item.id()), firstNote.get(item.id())));
                seen.add(item.id());
                if (occurrence.noteNumber() != null) {
                    lastNote.put(item.id(), occurrence.noteNumber());
                    firstNote.putIfAbsent(item.id(), occurrence.noteNumber());
                }
                previous = item;
            }
            if (!items.isEmpty()) {
                previousSize = items.size();
            }
        }
        return placements;
    }

    /**
     * @param previous the cite this one may repeat, or {@code null} when it cannot be an ibid
     */
    static Position computePosition(CiteItem item, CiteItem previous, Set<String> seen) {
        if (!seen.contains(item.id())) {
            return Position.FIRST;
        }
        if (previous == null || !previous.id().equals(item.id())) {
            return Position.SUBSEQUENT;
        }
        if (item.hasLocator()) {
            return previous.hasLocator() && previous.locator().equals(item.locator())
                ? Position.IBID
                : Position.IBID_WITH_LOCATOR;
        }
        return previous.hasLocator() ? Position.SUBSEQUENT : Position.IBID;
    }

    private static void warnOnce(List<String> warnings, String message) {
        if (!warnings.contains(message)) {
            log.warn(message);
            warnings.add(message);
        }
    }

    record Placement(Position position, Integer previousNote, Integer firstNote) {}

    public static final class Builder {
        private final Style style;
        private final List<Entry> entries = new ArrayList<>();
        private LocaleResolver locale;
        private String language;
        private OutputFormat format = OutputFormat.TEXT;
        private boolean memoizeMacros = true;
        private int nearNoteDistance = RenderContext.DEFAULT_NEAR_NOTE_DISTANCE;
        private int maxIterations = DisambiguationEngine.DEFAULT_MAX_ITERATIONS;

        private Builder(Style style) {
            this.style = style;
        }

        public Builder entries(List<Entry> entries) {
            this.entries.addAll(entries);
            return this;
        }

        public Builder entry(Entry entry) {
            this.entries.add(entry);
            return this;
        }

        public Builder locale(LocaleResolver locale) {
            this.locale = locale;
            return this;
        }

        /**
         * Language used when no resolver is given; defaults to the style's {@code default-locale}.
         */
        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder format(OutputFormat format) {
            this.format = format;
            return this;
        }

        public Builder memoizeMacros(boolean memoizeMacros) {
            this.memoizeMacros = memoizeMacros;
            return this;
        }

        public Builder nearNoteDistance(int nearNoteDistance) {
            this.nearNoteDistance = nearNoteDistance;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public EngineSession build() {
            return new EngineSession(this);
        }
    }
}
