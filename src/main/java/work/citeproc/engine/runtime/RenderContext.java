package work.citeproc.engine.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.citeproc.engine.data.CiteItem;
import work.citeproc.engine.data.Entry;
import work.citeproc.engine.data.Position;
import work.citeproc.engine.data.VariableAccessor;
import work.citeproc.engine.disambiguation.DisambiguationState;
import work.citeproc.engine.locale.LocaleResolver;
import work.citeproc.engine.style.Definition;
import work.citeproc.engine.style.Node;
import work.citeproc.engine.style.Style;

/**
 * State of one interpretation pass: one entry rendered for one target with one disambiguation snapshot.
 * Owns the macro cache, which therefore never leaks across entries.
 */
public final class RenderContext {
    public static final int DEFAULT_NEAR_NOTE_DISTANCE = 5;

    private final Style style;
    private final RenderTarget target;
    private final Definition definition;
    private final LocaleResolver locale;
    private final VariableAccessor variables;
    private final DisambiguationState state;
    private final Position position;
    private final CiteItem item;
    private final Integer noteNumber;
    private final Integer previousNoteNumber;
    private final int nearNoteDistance;
    private final boolean memoizeMacros;
    private final SortNameOptions sortNameOptions;
    private final String namesReplacement;
    private final Node suppressedNames;
    private final List<String> warnings;

    private final Map<String, MacroResult> macroCache = new HashMap<>();
    private final Deque<String> macroStack = new ArrayDeque<>();
    private final Map<String, Node> substituted = new LinkedHashMap<>();
    private int macroExpansions;
    private int variablesCalled;
    private int variablesRendered;
    private int contextSensitiveMarks;
    private String precedingText = "";
    private Node yearSuffixOwner;
    private Node substituteOwner;
    private List<String> recorder;

    private RenderContext(Builder builder) {
        this.style = Objects.requireNonNull(builder.style, "style");
        this.target = Objects.requireNonNull(builder.target, "target");
        this.definition = target == RenderTarget.CITATION
            ? style.citation()
            : style.bibliography().orElse(style.citation());
        this.locale = Objects.requireNonNull(builder.locale, "locale");
        var injected = new LinkedHashMap<String, String>(builder.injected);
        this.state = builder.state == null ? DisambiguationState.INITIAL : builder.state;
        if (state.yearSuffix() != null) {
            injected.put("year-suffix", state.yearSuffixText());
        }
        this.item = builder.item;
        if (item != null && item.hasLocator()) {
            injected.put("locator", item.locator());
        }
        this.variables = new VariableAccessor(Objects.requireNonNull(builder.entry, "entry"), injected);
        this.position = builder.position == null ? Position.FIRST : builder.position;
        this.noteNumber = builder.noteNumber;
        this.previousNoteNumber = builder.previousNoteNumber;
        this.nearNoteDistance = builder.nearNoteDistance;
        this.memoizeMacros = builder.memoizeMacros;
        this.sortNameOptions = builder.sortNameOptions;
        this.namesReplacement = builder.namesReplacement;
        this.warnings = builder.warnings == null ? new ArrayList<>() : builder.warnings;
        this.suppressedNames = builder.suppressAuthor || namesReplacement != null
            ? style.firstNames(definition.layoutFor(variables.entry().language())).orElse(null)
            : null;
    }

    public static Builder builder(Style style, Entry entry, LocaleResolver locale) {
        return new Builder(style, entry, locale);
    }

    public Style style() {
        return style;
    }

    public RenderTarget target() {
        return target;
    }

    public Definition definition() {
        return definition;
    }

    public LocaleResolver locale() {
        return locale;
    }

    public VariableAccessor variables() {
        return variables;
    }

    public DisambiguationState state() {
        return state;
    }

    public Position position() {
        return position;
    }

    public CiteItem item() {
        return item;
    }

    public Integer noteNumber() {
        return noteNumber;
    }

    public Integer previousNoteNumber() {
        return previousNoteNumber;
    }

    public int nearNoteDistance() {
        return nearNoteDistance;
    }

    public boolean memoizeMacros() {
        return memoizeMacros;
    }

    public SortNameOptions sortNameOptions() {
        return sortNameOptions;
    }

    public int macroExpansions() {
        return macroExpansions;
    }

    public List<String> warnings() {
        return warnings;
    }

    public void warn(String message) {
        if (!warnings.contains(message)) {
            warnings.add(message);
        }
    }

    /**
     * Inheritable option: the citation/bibliography element first, then the style root.
     */
    public String inherited(String name) {
        var value = definition.option(name);
        return value != null ? value : style.option(name);
    }

    public String inherited(String name, String fallback) {
        var value = inherited(name);
        return value == null ? fallback : value;
    }

    /**
     * Text standing in for the first names element ({@code subsequent-author-substitute}), or {@code null} when
     * that element is suppressed outright.
     */
    String namesReplacement() {
        return namesReplacement;
    }

    boolean isSuppressedNames(Node names) {
        return suppressedNames != null && suppressedNames == names;
    }

    // variable bookkeeping used by group suppression

    int variablesCalled() {
        return variablesCalled;
    }

    int variablesRendered() {
        return variablesRendered;
    }

    void noteVariableCall() {
        variablesCalled++;
    }

    void noteVariableRendered(String variable) {
        variablesRendered++;
        if (recorder != null) {
            recorder.add(variable);
        }
    }

    void replay(MacroResult result) {
        variablesCalled += result.variablesCalled();
        variablesRendered += result.variablesRendered();
        if (recorder != null) {
            recorder.addAll(result.renderedVariables());
        }
    }

    /**
     * Starts collecting the names of rendered variables.
     *
     * @return the previous recorder, to hand back to {@link #restoreRecorder(List)}
     */
    List<String> startRecording() {
        var previous = recorder;
        recorder = new ArrayList<>();
        return previous;
    }

    List<String> recorded() {
        return recorder == null ? List.of() : recorder;
    }

    void restoreRecorder(List<String> previous) {
        if (previous != null && recorder != null) {
            previous.addAll(recorder);
        }
        recorder = previous;
    }

    /**
     * While a {@code <substitute>} renders, variable checks are made on behalf of its enclosing {@code <names>}.
     */
    Node substituteOwner() {
        return substituteOwner;
    }

    Node enterSubstitute(Node owner) {
        var previous = substituteOwner;
        substituteOwner = owner;
        return previous;
    }

    void exitSubstitute(Node previous) {
        substituteOwner = previous;
    }

    /**
     * A variable consumed by {@code <substitute>} is hidden from every other element of this render; its owner
     * keeps rendering it.
     */
    boolean isSubstituted(String variable, Node requester) {
        var owner = substituted.get(variable);
        return owner != null && owner != requester;
    }

    void markSubstituted(String variable, Node owner) {
        if (substituted.putIfAbsent(variable, owner) == null) {
            // cached expansions may still show the variable
            macroCache.clear();
        }
    }

    String precedingText() {
        return precedingText;
    }

    void setPrecedingText(String text) {
        this.precedingText = text == null ? "" : text;
    }

    void markContextSensitive() {
        contextSensitiveMarks++;
    }

    int contextSensitiveMarks() {
        return contextSensitiveMarks;
    }

    /**
     * The first date node rendering a year owns the automatic year-suffix.
     */
    boolean claimYearSuffix(Node dateNode) {
        if (state.yearSuffix() == null || style.referencesVariable("year-suffix")) {
            return false;
        }
        if (yearSuffixOwner == null) {
            yearSuffixOwner = dateNode;
        }
        return yearSuffixOwner == dateNode;
    }

    MacroResult cachedMacro(String name) {
        return memoizeMacros ? macroCache.get(name) : null;
    }

    void cacheMacro(String name, MacroResult result) {
        if (memoizeMacros) {
            macroCache.put(name, result);
        }
    }

    boolean enterMacro(String name) {
        if (macroStack.contains(name)) {
            return false;
        }
        macroStack.push(name);
        macroExpansions++;
        return true;
    }

    void exitMacro() {
        macroStack.pop();
    }

    public static final class Builder {
        private final Style style;
        private final Entry entry;
        private final LocaleResolver locale;
        private RenderTarget target = RenderTarget.BIBLIOGRAPHY;
        private DisambiguationState state;
        private final Map<String, String> injected = new LinkedHashMap<>();
        private Position position;
        private CiteItem item;
        private Integer noteNumber;
        private Integer previousNoteNumber;
        private int nearNoteDistance = DEFAULT_NEAR_NOTE_DISTANCE;
        private boolean memoizeMacros = true;
        private boolean suppressAuthor;
        private SortNameOptions sortNameOptions;
        private String namesReplacement;
        private List<String> warnings;

        private Builder(Style style, Entry entry, LocaleResolver locale) {
            this.style = style;
            this.entry = entry;
            this.locale = locale;
        }

        public Builder target(RenderTarget target) {
            this.target = target;
            return this;
        }

        public Builder state(DisambiguationState state) {
            this.state = state;
            return this;
        }

        public Builder citationNumber(int number) {
            injected.put("citation-number", Integer.toString(number));
            return this;
        }

        public Builder firstReferenceNoteNumber(Integer note) {
            if (note != null) {
                injected.put("first-reference-note-number", Integer.toString(note));
            }
            return this;
        }

        public Builder inject(String variable, String value) {
            if (value != null) {
                injected.put(variable, value);
            }
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder item(CiteItem item) {
            this.item = item;
            return this;
        }

        public Builder noteNumber(Integer noteNumber) {
            this.noteNumber = noteNumber;
            return this;
        }

        public Builder previousNoteNumber(Integer previousNoteNumber) {
            this.previousNoteNumber = previousNoteNumber;
            return this;
        }

        public Builder nearNoteDistance(int nearNoteDistance) {
            this.nearNoteDistance = nearNoteDistance;
            return this;
        }

        public Builder memoizeMacros(boolean memoizeMacros) {
            this.memoizeMacros = memoizeMacros;
            return this;
        }

        public Builder suppressAuthor(boolean suppressAuthor) {
            this.suppressAuthor = suppressAuthor;
            return this;
        }

        public Builder sortNameOptions(SortNameOptions sortNameOptions) {
            this.sortNameOptions = sortNameOptions;
            return this;
        }

        public Builder replaceFirstNames(String replacement) {
            this.namesReplacement = replacement;
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings = warnings;
            return this;
        }

        public RenderContext build() {
            return new RenderContext(this);
        }
    }
}
