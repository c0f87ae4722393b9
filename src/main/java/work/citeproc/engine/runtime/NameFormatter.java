package work.citeproc.engine.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.citeproc.engine.data.Name;
import work.citeproc.engine.data.Position;
import work.citeproc.engine.locale.TermForm;
import work.citeproc.engine.output.Output;
import work.citeproc.engine.style.Node;
import work.citeproc.engine.style.NodeKind;

/**
 * Renders the name lists of a {@code <names>} element: suppression, et-al truncation, per-name layout, joining
 * and CSL-M institution grouping.
 */
public final class NameFormatter {
    private static final Logger log = LogManager.getLogger(NameFormatter.class);

    static final int DEFAULT_ET_AL_MIN = 4;
    static final int DEFAULT_ET_AL_USE_FIRST = 3;
    private static final Node EMPTY_NAME = Node.of(NodeKind.NAME, Map.of());

    private NameFormatter() {}

    /**
     * Renders every variable of {@code names}, joined by the element delimiter. Labels are included; the
     * element's own affixes and formatting are left to the caller.
     */
    public static Output format(Node names, RenderContext ctx) {
        return format(names, variables(names), ctx);
    }

    /**
     * Renders only {@code variables}, a subset of the element's own list.
     */
    public static Output format(Node names, List<String> variables, RenderContext ctx) {
        var name = names.first(NodeKind.NAME).orElse(EMPTY_NAME);
        if ("count".equals(name.attr("form"))) {
            int total = 0;
            for (var variable : variables) {
                var list = ctx.variables().names(variable);
                var kept = suppress(list, name, names);
                total += kept == null ? list.size() : shownCount(kept, name, ctx);
            }
            return total == 0 ? Output.EMPTY : Output.text(Integer.toString(total));
        }
        var rendered = new ArrayList<Output>();
        var editor = ctx.variables().names("editor");
        boolean editorTranslator = variables.contains("editor") && variables.contains("translator")
            && !editor.isEmpty() && editor.equals(ctx.variables().names("translator"));
        for (var variable : variables) {
            if (editorTranslator && "translator".equals(variable)) {
                continue;
            }
            var role = editorTranslator && "editor".equals(variable) ? "editortranslator" : variable;
            rendered.add(formatVariable(names, name, ctx.variables().names(variable), role, ctx));
        }
        return Output.join(rendered, names.attr("delimiter", ctx.inherited("names-delimiter", ", ")));
    }

    public static List<String> variables(Node names) {
        var attribute = names.attr("variable", "");
        var list = new ArrayList<String>();
        for (var token : attribute.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                list.add(token);
            }
        }
        return list;
    }

    private static Output formatVariable(Node names, Node name, List<Name> list, String role, RenderContext ctx) {
        var kept = suppress(list, name, names);
        if (kept.isEmpty()) {
            return Output.EMPTY;
        }
        var body = formatList(kept, name, names, ctx);
        if (body.isEmpty()) {
            return Output.EMPTY;
        }
        var label = names.first(NodeKind.LABEL);
        if (label.isEmpty()) {
            return body;
        }
        var form = TermForm.from(label.get().attr("form"));
        var term = ctx.locale().term(role, form, kept.size() > 1);
        var labelOutput = Decorations.apply(label.get().attributes(), Output.text(term), ctx);
        boolean labelFirst = names.children().indexOf(label.get()) < names.children().indexOf(name);
        return labelFirst ? Output.seq(labelOutput, body) : Output.seq(body, labelOutput);
    }

    /**
     * CSL-M {@code suppress-min}/{@code suppress-max}.
     *
     * @return the names to render, an empty list when suppressed, or {@code null} when a {@code count} form
     *         reports the full list size in place of the names
     */
    static List<Name> suppress(List<Name> list, Node name, Node names) {
        var min = option(name, names, "suppress-min");
        var max = option(name, names, "suppress-max");
        if (min != null) {
            int threshold = parse(min, -1);
            if (threshold == 0) {
                var institutions = new ArrayList<Name>();
                for (var candidate : list) {
                    if (candidate.isInstitution()) {
                        institutions.add(candidate);
                    }
                }
                return institutions;
            }
            if (threshold > 0 && list.size() >= threshold) {
                return List.of();
            }
        }
        if (max != null) {
            int threshold = parse(max, -1);
            if (threshold >= 0 && list.size() <= threshold && !list.isEmpty()) {
                return "count".equals(name.attr("form")) ? null : List.of();
            }
        }
        return list;
    }

    private static String option(Node name, Node names, String attribute) {
        var value = name.attr(attribute);
        return value != null ? value : names.attr(attribute);
    }

    private static int parse(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    /**
     * Et-al cut-off for a list, honouring subsequent-position overrides, sort-key overrides and disambiguation
     * name expansion.
     */
    static EtAl etAl(int count, Node name, RenderContext ctx) {
        var sortOptions = ctx.sortNameOptions();
        boolean subsequent = ctx.target() == RenderTarget.CITATION && ctx.position() != null
            && ctx.position() != Position.FIRST;
        int min = intOption(name, ctx, "et-al-min", DEFAULT_ET_AL_MIN);
        int useFirst = intOption(name, ctx, "et-al-use-first", DEFAULT_ET_AL_USE_FIRST);
        if (subsequent) {
            min = intOption(name, ctx, "et-al-subsequent-min", min);
            useFirst = intOption(name, ctx, "et-al-subsequent-use-first", useFirst);
        }
        boolean useLast = "true".equals(attrOrInherited(name, ctx, "et-al-use-last"));
        if (sortOptions != null) {
            min = sortOptions.etAlMin() != null ? sortOptions.etAlMin() : min;
            useFirst = sortOptions.etAlUseFirst() != null ? sortOptions.etAlUseFirst() : useFirst;
            useLast = sortOptions.etAlUseLast() != null ? sortOptions.etAlUseLast() : useLast;
        }
        if (min <= 0 || count < min) {
            return new EtAl(count, false, false);
        }
        int shown = Math.min(Math.max(useFirst, 1) + expansion(ctx), count);
        if (shown >= count) {
            return new EtAl(count, false, false);
        }
        return new EtAl(shown, true, useLast && count - shown >= 2);
    }

    /**
     * Number of names a list of {@code count} names shows under the element's et-al settings and the context's
     * disambiguation state.
     */
    public static int shownNames(Node names, int count, RenderContext ctx) {
        if (count == 0) {
            return 0;
        }
        return etAl(count, names.first(NodeKind.NAME).orElse(EMPTY_NAME), ctx).shown();
    }

    private static int expansion(RenderContext ctx) {
        return ctx.target() == RenderTarget.CITATION && ctx.sortNameOptions() == null ? ctx.state().namesExpanded() : 0;
    }

    private static int shownCount(List<Name> list, Node name, RenderContext ctx) {
        return list.isEmpty() ? 0 : etAl(list.size(), name, ctx).shown();
    }

    private static int intOption(Node name, RenderContext ctx, String attribute, int fallback) {
        var value = attrOrInherited(name, ctx, attribute);
        return value == null ? fallback : parse(value, fallback);
    }

    private static String attrOrInherited(Node name, RenderContext ctx, String attribute) {
        var value = name.attr(attribute);
        return value != null ? value : ctx.inherited(attribute);
    }

    private static Output formatList(List<Name> list, Node name, Node names, RenderContext ctx) {
        var cut = etAl(list.size(), name, ctx);
        var shown = list.subList(0, cut.shown());
        var options = NameOptions.resolve(name, ctx);
        var rendered = new ArrayList<Output>();
        var inverted = new ArrayList<Boolean>();
        for (int i = 0; i < shown.size(); i++) {
            var current = shown.get(i);
            boolean invert = !current.isInstitution() && options.inverted(i);
            inverted.add(invert);
            rendered.add(formatName(current, name, names, options, invert, ctx));
        }
        Output joined;
        if (hasInstitution(shown) && hasPersonal(shown)) {
            joined = joinInstitutional(shown, rendered, inverted, options, ctx);
        } else {
            joined = joinNames(rendered, inverted, options, cut.truncated(), ctx);
        }
        if (cut.useLast()) {
            var last = list.get(list.size() - 1);
            var lastRendered = formatName(last, name, names, options, !last.isInstitution() && options.inverted(1), ctx);
            joined = Output.seq(joined, Output.text(options.delimiter() + "… "), lastRendered);
        } else if (cut.truncated()) {
            joined = Output.seq(joined, etAlTerm(names, options, inverted, ctx));
        }
        return Decorations.apply(name.attributes(), joined, ctx);
    }

    private static Output etAlTerm(Node names, NameOptions options, List<Boolean> inverted, RenderContext ctx) {
        var etAl = names.first(NodeKind.ET_AL);
        var termName = etAl.map(node -> node.attr("term", "et-al")).orElse("et-al");
        var term = ctx.locale().term(termName, TermForm.LONG, false);
        if (term.isEmpty()) {
            return Output.EMPTY;
        }
        var precedes = options.delimiterPrecedesEtAl();
        boolean useDelimiter = switch (precedes) {
            case "always" -> true;
            case "never" -> false;
            case "after-inverted-name" -> !inverted.isEmpty() && inverted.get(inverted.size() - 1);
            default -> inverted.size() >= 2;
        };
        var rendered = etAl.map(node -> Decorations.apply(node.attributes(), Output.text(term), ctx))
            .orElse(Output.text(term));
        return Output.seq(Output.text(useDelimiter ? options.delimiter() : " "), rendered);
    }

    private static Output joinNames(List<Output> rendered, List<Boolean> inverted, NameOptions options,
                                    boolean truncated, RenderContext ctx) {
        if (rendered.size() == 1) {
            return rendered.get(0);
        }
        var and = andTerm(options, ctx);
        if (and.isEmpty() || truncated) {
            return Output.join(rendered, options.delimiter());
        }
        var head = Output.join(rendered.subList(0, rendered.size() - 1), options.delimiter());
        boolean delimiterBeforeLast = switch (options.delimiterPrecedesLast()) {
            case "always" -> true;
            case "never" -> false;
            case "after-inverted-name" -> inverted.get(inverted.size() - 2);
            default -> rendered.size() >= 3;
        };
        var connector = delimiterBeforeLast ? options.delimiter() + and + " " : " " + and + " ";
        return Output.seq(head, Output.text(connector), rendered.get(rendered.size() - 1));
    }

    /**
     * Personal names preceding an institution are affiliated with it; personal names after the last institution
     * are unaffiliated and lead the rendering, joined to the institutional groups with the "with" term.
     */
    private static Output joinInstitutional(List<Name> shown, List<Output> rendered, List<Boolean> inverted,
                                            NameOptions options, RenderContext ctx) {
        var groups = new ArrayList<Output>();
        var pending = new ArrayList<Output>();
        var pendingInverted = new ArrayList<Boolean>();
        for (int i = 0; i < shown.size(); i++) {
            pending.add(rendered.get(i));
            pendingInverted.add(inverted.get(i));
            if (shown.get(i).isInstitution()) {
                groups.add(joinNames(pending, pendingInverted, options, false, ctx));
                pending = new ArrayList<>();
                pendingInverted = new ArrayList<>();
            }
        }
        var institutional = Output.join(groups, options.delimiter());
        if (pending.isEmpty()) {
            return institutional;
        }
        var unaffiliated = joinNames(pending, pendingInverted, options, false, ctx);
        var with = ctx.locale().term("with");
        return Output.seq(unaffiliated, Output.text(" " + (with.isEmpty() ? "with" : with) + " "), institutional);
    }

    private static String andTerm(NameOptions options, RenderContext ctx) {
        return switch (options.and()) {
            case "text" -> ctx.locale().term("and");
            case "symbol" -> "&";
            default -> "";
        };
    }

    private static boolean hasInstitution(List<Name> names) {
        for (var name : names) {
            if (name.isInstitution()) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasPersonal(List<Name> names) {
        for (var name : names) {
            if (!name.isInstitution()) {
                return true;
            }
        }
        return false;
    }

    static Output formatName(Name value, Node name, Node names, NameOptions options, boolean inverted,
                             RenderContext ctx) {
        if (value.isInstitution()) {
            return formatInstitution(value, names, ctx);
        }
        var family = namePart(name, "family", familyText(value, options, inverted), ctx);
        if ("short".equals(options.form()) && !family.isEmpty()) {
            return family;
        }
        var givenText = givenText(value, options);
        var trailingParticles = inverted ? invertedParticles(value, options) : "";
        var given = namePart(name, "given", join(givenText, trailingParticles), ctx);
        var suffix = value.suffix() == null || value.suffix().isBlank() ? "" : " " + value.suffix().trim();
        if (given.isEmpty()) {
            return Output.seq(family, Output.text(suffix));
        }
        if (family.isEmpty()) {
            return Output.seq(given, Output.text(suffix));
        }
        if (inverted) {
            return Output.seq(family, Output.text(options.sortSeparator()), given, Output.text(suffix));
        }
        return Output.seq(given, Output.text(" "), family, Output.text(suffix));
    }

    private static Output namePart(Node name, String part, String text, RenderContext ctx) {
        if (text.isEmpty()) {
            return Output.EMPTY;
        }
        for (var child : name.children(NodeKind.NAME_PART)) {
            if (part.equals(child.attr("name"))) {
                return Decorations.apply(child.attributes(), Output.text(text), ctx);
            }
        }
        return Output.text(text);
    }

    private static String familyText(Name value, NameOptions options, boolean inverted) {
        var family = value.family() == null ? "" : value.family().trim();
        var nonDropping = value.nonDroppingParticle();
        boolean keepNonDropping = nonDropping != null && !nonDropping.isBlank()
            && (!inverted || "never".equals(options.demoteParticle()));
        if (keepNonDropping) {
            family = joinParticle(nonDropping.trim(), family);
        }
        var dropping = value.droppingParticle();
        if (!inverted && !"short".equals(options.form()) && dropping != null && !dropping.isBlank()) {
            family = joinParticle(dropping.trim(), family);
        }
        return family;
    }

    private static String invertedParticles(Name value, NameOptions options) {
        var particles = new ArrayList<String>();
        if (value.droppingParticle() != null && !value.droppingParticle().isBlank()) {
            particles.add(value.droppingParticle().trim());
        }
        if (!"never".equals(options.demoteParticle())
            && value.nonDroppingParticle() != null && !value.nonDroppingParticle().isBlank()) {
            particles.add(value.nonDroppingParticle().trim());
        }
        return String.join(" ", particles);
    }

    private static String givenText(Name value, NameOptions options) {
        var given = value.given() == null ? "" : value.given().trim();
        if (given.isEmpty() || options.initializeWith() == null || !options.initialize()) {
            return given;
        }
        return initialize(given, options.initializeWith(), options.initializeWithHyphen());
    }

    /**
     * Reduces given names to initials: "John Ronald" with ". " gives "J. R.", "Jean-Paul" gives "J.-P.".
     */
    public static String initialize(String given, String initializeWith, boolean hyphen) {
        var marker = initializeWith.stripTrailing();
        var spacing = initializeWith.substring(marker.length());
        var builder = new StringBuilder();
        for (var token : given.trim().split("\\s+")) {
            var pieces = new ArrayList<String>();
            for (var piece : token.split("-")) {
                var letters = piece.replace(".", "");
                if (!letters.isEmpty()) {
                    pieces.add(letters.substring(0, 1).toUpperCase(Locale.ROOT) + marker);
                }
            }
            if (pieces.isEmpty()) {
                continue;
            }
            builder.append(String.join(hyphen ? "-" : "", pieces)).append(spacing.isEmpty() ? "" : spacing);
        }
        return builder.toString().stripTrailing();
    }

    private static String join(String first, String second) {
        if (first.isEmpty()) {
            return second;
        }
        return second.isEmpty() ? first : first + " " + second;
    }

    private static String joinParticle(String particle, String family) {
        if (family.isEmpty()) {
            return particle;
        }
        if (particle.endsWith("'") || particle.endsWith("’") || particle.endsWith("-")) {
            return particle + family;
        }
        return particle + " " + family;
    }

    /**
     * Institution names: {@code |}-separated subunits, optionally reversed and truncated by an
     * {@code <institution>} child of {@code <names>}.
     */
    static Output formatInstitution(Name value, Node names, RenderContext ctx) {
        var raw = value.literal() != null && !value.literal().isBlank() ? value.literal() : value.family();
        var units = new ArrayList<String>();
        for (var unit : raw.split("\\|")) {
            if (!unit.isBlank()) {
                units.add(unit.trim());
            }
        }
        var institution = names.first(NodeKind.INSTITUTION).orElse(null);
        if (institution == null) {
            return Output.text(String.join(", ", units));
        }
        var parts = institution.attr("institution-parts", "long");
        if (!"long".equals(parts)) {
            var message = "institution-parts=\"" + parts + "\" is not supported, rendering the long form";
            log.warn(message);
            ctx.warn(message);
        }
        if (institution.flag("reverse-order")) {
            Collections.reverse(units);
        }
        int useFirst = institution.intAttr("use-first", 0);
        int useLast = institution.intAttr("use-last", 0);
        if (useFirst > 0 || useLast > 0) {
            var truncated = new ArrayList<String>();
            truncated.addAll(units.subList(0, Math.min(useFirst, units.size())));
            int from = Math.max(truncated.size(), units.size() - useLast);
            truncated.addAll(units.subList(from, units.size()));
            units = truncated;
        }
        var rendered = new ArrayList<Output>();
        var partNode = institution.first(NodeKind.INSTITUTION_PART).orElse(null);
        for (var unit : units) {
            rendered.add(partNode == null ? Output.text(unit)
                : Decorations.apply(partNode.attributes(), Output.text(unit), ctx));
        }
        return Decorations.apply(institution.attributes(), Output.join(rendered, institution.attr("delimiter", ", ")), ctx);
    }

    /**
     * Outcome of the et-al decision for one list.
     */
    record EtAl(int shown, boolean truncated, boolean useLast) {}

    /**
     * Name layout options of one {@code <name>} element after inheritance and disambiguation overrides.
     */
    record NameOptions(
        String form,
        String and,
        String delimiter,
        String delimiterPrecedesLast,
        String delimiterPrecedesEtAl,
        String nameAsSortOrder,
        String sortSeparator,
        String initializeWith,
        boolean initialize,
        boolean initializeWithHyphen,
        String demoteParticle
    ) {
        static NameOptions resolve(Node name, RenderContext ctx) {
            var form = value(name, ctx, "form", "name-form", "long");
            var initializeWith = value(name, ctx, "initialize-with", "initialize-with", null);
            if (ctx.target() == RenderTarget.CITATION && ctx.sortNameOptions() == null) {
                int level = ctx.state().givennameLevel();
                if (level >= 1 && "short".equals(form)) {
                    form = "long";
                    if (initializeWith == null && level == 1) {
                        initializeWith = ". ";
                    }
                }
                if (level >= 2) {
                    form = "long";
                    initializeWith = null;
                }
            }
            return new NameOptions(
                form,
                value(name, ctx, "and", "and", ""),
                value(name, ctx, "delimiter", "name-delimiter", ", "),
                value(name, ctx, "delimiter-precedes-last", "delimiter-precedes-last", "contextual"),
                value(name, ctx, "delimiter-precedes-et-al", "delimiter-precedes-et-al", "contextual"),
                value(name, ctx, "name-as-sort-order", "name-as-sort-order", ""),
                value(name, ctx, "sort-separator", "sort-separator", ", "),
                initializeWith,
                !"false".equals(value(name, ctx, "initialize", "initialize", "true")),
                !"false".equals(ctx.inherited("initialize-with-hyphen", "true")),
                ctx.inherited("demote-non-dropping-particle", "display-and-sort")
            );
        }

        boolean inverted(int index) {
            return switch (nameAsSortOrder) {
                case "all" -> true;
                case "first" -> index == 0;
                default -> false;
            };
        }

        private static String value(Node name, RenderContext ctx, String attribute, String inherited, String fallback) {
            var own = name.attr(attribute);
            if (own != null) {
                return own;
            }
            var value = ctx.inherited(inherited);
            return value != null ? value : fallback;
        }
    }
}
