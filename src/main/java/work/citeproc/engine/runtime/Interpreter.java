package work.citeproc.engine.runtime;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.citeproc.engine.locale.TermForm;
import work.citeproc.engine.output.Output;
import work.citeproc.engine.style.Layout;
import work.citeproc.engine.style.Node;
import work.citeproc.engine.style.NodeKind;

/**
 * Renders style nodes against one {@link RenderContext}. Macros are expanded at most once per context; later
 * calls reuse the cached pre-formatting output and apply only their own formatting.
 */
public final class Interpreter {
    private static final Logger log = LogManager.getLogger(Interpreter.class);

    private Interpreter() {}

    /**
     * Renders a layout for the context's entry. Bibliography entries carry the layout affixes; citation layouts
     * leave them to the cluster.
     */
    public static Output renderLayout(Layout layout, RenderContext ctx) {
        var body = render(layout.children(), ctx);
        boolean withAffixes = ctx.target() == RenderTarget.BIBLIOGRAPHY;
        return Decorations.apply(layout.attributes(), body, ctx, withAffixes);
    }

    public static Output render(List<Node> nodes, RenderContext ctx) {
        return renderSequence(nodes, ctx, "");
    }

    static Output renderSequence(List<Node> nodes, RenderContext ctx, String delimiter) {
        var parts = new ArrayList<Output>();
        var preceding = new StringBuilder(ctx.precedingText());
        for (var node : nodes) {
            ctx.setPrecedingText(preceding.toString());
            var output = renderNode(node, ctx);
            if (output.isEmpty()) {
                continue;
            }
            if (!parts.isEmpty()) {
                preceding.append(delimiter);
            }
            preceding.append(output.plainText());
            parts.add(output);
        }
        ctx.setPrecedingText(preceding.toString());
        return Output.join(parts, delimiter);
    }

    public static Output renderNode(Node node, RenderContext ctx) {
        return switch (node.kind()) {
            case TEXT -> text(node, ctx);
            case GROUP -> group(node, ctx);
            case CHOOSE -> choose(node, ctx);
            case NAMES -> names(node, ctx);
            case DATE -> date(node, ctx);
            case NUMBER -> number(node, ctx);
            case LABEL -> label(node, ctx);
            case IF, ELSE_IF, ELSE, CONDITIONS, CONDITION, NAME, NAME_PART, ET_AL, SUBSTITUTE, INSTITUTION,
                INSTITUTION_PART, DATE_PART -> Output.EMPTY;
        };
    }

    private static Output text(Node node, RenderContext ctx) {
        Output content;
        if (node.has("macro")) {
            content = macro(node.attr("macro"), ctx);
        } else if (node.has("variable")) {
            content = Output.text(variableText(node, ctx));
        } else if (node.has("value")) {
            content = Output.text(node.attr("value"));
        } else if (node.has("term")) {
            var plural = "true".equals(node.attr("plural"));
            content = Output.text(ctx.locale().term(node.attr("term"), TermForm.from(node.attr("form")), plural));
        } else {
            content = Output.EMPTY;
        }
        return Decorations.apply(node.attributes(), content, ctx);
    }

    private static String variableText(Node node, RenderContext ctx) {
        var variable = node.attr("variable");
        ctx.noteVariableCall();
        if (ctx.isSubstituted(variable, requester(node, ctx))) {
            return "";
        }
        String value = null;
        if ("short".equals(node.attr("form"))) {
            value = ctx.variables().value(variable + "-short");
        }
        if (value == null) {
            value = ctx.variables().value(variable);
        }
        if (value == null) {
            return "";
        }
        if ("page".equals(variable) || ("locator".equals(variable) && isPageLocator(ctx))) {
            value = NumberFormatter.pageRange(value, ctx.inherited("page-range-format"), pageRangeDelimiter(ctx));
        }
        ctx.noteVariableRendered(variable);
        return value;
    }

    private static boolean isPageLocator(RenderContext ctx) {
        var item = ctx.item();
        return item == null || item.label() == null || item.label().isBlank() || "page".equals(item.label());
    }

    private static String pageRangeDelimiter(RenderContext ctx) {
        var term = ctx.locale().term("page-range-delimiter", TermForm.LONG, false);
        return term.isEmpty() ? "–" : term;
    }

    private static Output macro(String name, RenderContext ctx) {
        boolean cacheable = ctx.substituteOwner() == null;
        if (cacheable) {
            var cached = ctx.cachedMacro(name);
            if (cached != null) {
                ctx.replay(cached);
                return cached.output();
            }
        }
        var body = ctx.style().macro(name);
        if (body == null) {
            log.debug("Macro '{}' is not defined, rendering nothing", name);
            return Output.EMPTY;
        }
        if (!ctx.enterMacro(name)) {
            log.warn("Macro '{}' calls itself, rendering nothing for the recursive call", name);
            return Output.EMPTY;
        }
        int called = ctx.variablesCalled();
        int rendered = ctx.variablesRendered();
        int sensitive = ctx.contextSensitiveMarks();
        var previous = ctx.startRecording();
        Output output;
        List<String> variables;
        try {
            output = renderSequence(body, ctx, "");
            variables = List.copyOf(ctx.recorded());
        } finally {
            ctx.restoreRecorder(previous);
            ctx.exitMacro();
        }
        if (cacheable && ctx.contextSensitiveMarks() == sensitive) {
            ctx.cacheMacro(name, new MacroResult(output, ctx.variablesCalled() - called,
                ctx.variablesRendered() - rendered, variables));
        }
        return output;
    }

    private static Output group(Node node, RenderContext ctx) {
        var before = ctx.precedingText();
        int called = ctx.variablesCalled();
        int rendered = ctx.variablesRendered();
        var output = renderSequence(node.children(), ctx, node.attr("delimiter", ""));
        if (output.isEmpty()) {
            return Output.EMPTY;
        }
        if (ctx.variablesCalled() > called && ctx.variablesRendered() == rendered) {
            return Output.EMPTY;
        }
        boolean requireSafe = "comma-safe".equals(node.attr("require"));
        boolean rejectSafe = "comma-safe".equals(node.attr("reject"));
        if (requireSafe || rejectSafe) {
            ctx.markContextSensitive();
            boolean safe = isCommaSafe(before, output.plainText());
            if ((requireSafe && !safe) || (rejectSafe && safe)) {
                return Output.EMPTY;
            }
        }
        return Decorations.apply(node.attributes(), output, ctx);
    }

    /**
     * A group is unsafe after a comma only when the text before it ends in a digit and the group starts with one.
     */
    static boolean isCommaSafe(String preceding, String output) {
        if (preceding == null || preceding.isEmpty() || output.isEmpty()) {
            return true;
        }
        return !(Character.isDigit(preceding.charAt(preceding.length() - 1)) && Character.isDigit(output.charAt(0)));
    }

    private static Output choose(Node node, RenderContext ctx) {
        for (var branch : node.children()) {
            if (branch.kind() != NodeKind.IF && branch.kind() != NodeKind.ELSE_IF && branch.kind() != NodeKind.ELSE) {
                continue;
            }
            if (ConditionEvaluator.evaluate(branch, ctx)) {
                return renderSequence(branch.children(), ctx, "");
            }
        }
        return Output.EMPTY;
    }

    private static Output names(Node node, RenderContext ctx) {
        if (ctx.isSuppressedNames(node)) {
            var replacement = ctx.namesReplacement();
            return replacement == null ? Output.EMPTY : Decorations.apply(node.attributes(), Output.text(replacement), ctx);
        }
        var requester = requester(node, ctx);
        var visible = new ArrayList<String>();
        for (var variable : NameFormatter.variables(node)) {
            ctx.noteVariableCall();
            if (!ctx.isSubstituted(variable, requester)) {
                visible.add(variable);
            }
        }
        var body = visible.isEmpty() ? Output.EMPTY : NameFormatter.format(node, visible, ctx);
        if (!body.isEmpty()) {
            for (var variable : visible) {
                if (!ctx.variables().names(variable).isEmpty()) {
                    ctx.noteVariableRendered(variable);
                }
            }
            return Decorations.apply(node.attributes(), body, ctx);
        }
        var substitute = node.first(NodeKind.SUBSTITUTE);
        if (substitute.isEmpty()) {
            return Output.EMPTY;
        }
        for (var child : substitute.get().children()) {
            var previousOwner = ctx.enterSubstitute(node);
            var previousRecorder = ctx.startRecording();
            Output output;
            List<String> substituted;
            try {
                output = renderNode(inheritNameLayout(child, node), ctx);
                substituted = List.copyOf(ctx.recorded());
            } finally {
                ctx.restoreRecorder(previousRecorder);
                ctx.exitSubstitute(previousOwner);
            }
            if (!output.isEmpty()) {
                for (var variable : substituted) {
                    ctx.markSubstituted(variable, node);
                }
                return Decorations.apply(node.attributes(), output, ctx);
            }
        }
        return Output.EMPTY;
    }

    /**
     * A bare {@code <names>} inside {@code <substitute>} borrows the name, et-al, label and institution children
     * of the element it substitutes for.
     */
    private static Node inheritNameLayout(Node child, Node parent) {
        if (child.kind() != NodeKind.NAMES || child.first(NodeKind.NAME).isPresent()) {
            return child;
        }
        var children = new ArrayList<Node>();
        for (var inherited : parent.children()) {
            if (inherited.kind() != NodeKind.SUBSTITUTE) {
                children.add(inherited);
            }
        }
        children.addAll(child.children());
        return new Node(NodeKind.NAMES, child.attributes(), children);
    }

    private static Node requester(Node node, RenderContext ctx) {
        var owner = ctx.substituteOwner();
        return owner != null ? owner : node;
    }

    private static Output date(Node node, RenderContext ctx) {
        var variable = node.attr("variable");
        ctx.noteVariableCall();
        if (variable == null || ctx.isSubstituted(variable, requester(node, ctx))) {
            return Output.EMPTY;
        }
        var parsed = DateParser.parse(ctx.variables().value(variable));
        if (parsed.isEmpty()) {
            return Output.EMPTY;
        }
        var value = parsed.get();
        var yearSuffix = "";
        if (!value.isLiteral() && value.start().year() != 0 && rendersYear(node, ctx) && ctx.claimYearSuffix(node)) {
            yearSuffix = ctx.state().yearSuffixText();
        }
        var output = DateFormatter.format(node, value, ctx, yearSuffix);
        if (output.isEmpty()) {
            return Output.EMPTY;
        }
        ctx.noteVariableRendered(variable);
        return Decorations.apply(node.attributes(), output, ctx);
    }

    private static boolean rendersYear(Node node, RenderContext ctx) {
        for (var part : DateFormatter.layout(node, ctx).parts()) {
            if ("year".equals(part.attr("name"))) {
                return true;
            }
        }
        return false;
    }

    private static Output number(Node node, RenderContext ctx) {
        var variable = node.attr("variable");
        ctx.noteVariableCall();
        if (variable == null || ctx.isSubstituted(variable, requester(node, ctx))) {
            return Output.EMPTY;
        }
        var value = ctx.variables().value(variable);
        if (value == null) {
            return Output.EMPTY;
        }
        var gender = ctx.locale().gender(variable).orElse(null);
        var text = NumberFormatter.format(value, node.attr("form", "numeric"), ctx.locale(), gender);
        ctx.noteVariableRendered(variable);
        return Decorations.apply(node.attributes(), Output.text(text), ctx);
    }

    private static boolean isCount(String variable) {
        return "number-of-pages".equals(variable) || "number-of-volumes".equals(variable);
    }

    private static boolean exceedsOne(String value) {
        try {
            return Integer.parseInt(value.trim()) > 1;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static Output label(Node node, RenderContext ctx) {
        var variable = node.attr("variable");
        if (variable == null) {
            return Output.EMPTY;
        }
        String term;
        String value;
        if ("locator".equals(variable)) {
            var item = ctx.item();
            if (item == null || !item.hasLocator()) {
                return Output.EMPTY;
            }
            term = item.label() == null || item.label().isBlank() ? "page" : item.label();
            value = item.locator();
        } else {
            value = ctx.variables().value(variable);
            term = switch (variable) {
                case "number-of-pages" -> "page";
                case "number-of-volumes" -> "volume";
                default -> variable;
            };
        }
        if (value == null) {
            return Output.EMPTY;
        }
        boolean plural = switch (node.attr("plural", "contextual")) {
            case "always" -> true;
            case "never" -> false;
            default -> NumberFormatter.isMultiple(value) || (isCount(variable) && exceedsOne(value));
        };
        var text = ctx.locale().term(term, TermForm.from(node.attr("form")), plural);
        return Decorations.apply(node.attributes(), Output.text(text), ctx);
    }
}
