package work.citeproc.engine.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import work.citeproc.engine.data.Position;
import work.citeproc.engine.data.TypeMapping;
import work.citeproc.engine.data.Variables;
import work.citeproc.engine.style.Node;
import work.citeproc.engine.style.NodeKind;

/**
 * Evaluates {@code <if>}/{@code <else-if>} branches, including CSL-M {@code <conditions>} blocks.
 */
public final class ConditionEvaluator {
    private static final Set<String> PREDICATES = Set.of(
        "type", "variable", "is-numeric", "is-uncertain-date", "position", "locator", "disambiguate", "context",
        "genre", "has-day", "has-year-only", "has-to-month-or-season", "is-multiple"
    );

    private ConditionEvaluator() {}

    /**
     * @return whether the branch applies; an {@code <else>} always does
     */
    public static boolean evaluate(Node branch, RenderContext ctx) {
        if (branch.kind() == NodeKind.ELSE) {
            return true;
        }
        var conditions = branch.first(NodeKind.CONDITIONS);
        if (conditions.isPresent()) {
            return evaluateConditions(conditions.get(), ctx);
        }
        return evaluateAttributes(branch, ctx);
    }

    private static boolean evaluateConditions(Node conditions, RenderContext ctx) {
        var results = new ArrayList<Boolean>();
        for (var child : conditions.children()) {
            if (child.kind() == NodeKind.CONDITION) {
                results.add(evaluateAttributes(child, ctx));
            } else if (child.kind() == NodeKind.CONDITIONS) {
                results.add(evaluateConditions(child, ctx));
            }
        }
        return combine(conditions.attr("match", "all"), results);
    }

    private static boolean evaluateAttributes(Node node, RenderContext ctx) {
        var results = new ArrayList<Boolean>();
        for (var entry : node.attributes().entrySet()) {
            if (!PREDICATES.contains(entry.getKey())) {
                continue;
            }
            for (var token : entry.getValue().trim().split("\\s+")) {
                if (!token.isEmpty()) {
                    results.add(test(entry.getKey(), token, ctx));
                }
            }
        }
        if (results.isEmpty()) {
            return false;
        }
        return combine(node.attr("match", "all"), results);
    }

    static boolean combine(String match, List<Boolean> results) {
        return switch (match) {
            case "any" -> results.contains(Boolean.TRUE);
            case "none" -> !results.contains(Boolean.TRUE);
            case "nand" -> results.contains(Boolean.FALSE);
            default -> !results.contains(Boolean.FALSE);
        };
    }

    static boolean test(String predicate, String token, RenderContext ctx) {
        var variables = ctx.variables();
        return switch (predicate) {
            case "type" -> TypeMapping.canonical(token).equals(variables.type());
            case "variable" -> variables.has(token);
            case "is-numeric" -> startsWithDigit(variables.value(token));
            case "is-uncertain-date" -> isUncertainDate(token, ctx);
            case "position" -> position(token, ctx);
            case "locator" -> locator(token, ctx);
            case "disambiguate" -> Boolean.parseBoolean(token) == ctx.state().disambiguateCondition();
            case "context" -> ctx.target().contextName().equals(token);
            case "genre" -> token.equalsIgnoreCase(variables.value("genre"));
            case "has-day" -> date(token, ctx).map(value -> value.start().hasDay()).orElse(false);
            case "has-year-only" -> date(token, ctx)
                .map(value -> value.start().month() == 0 && (value.end() == null || value.end().month() == 0))
                .orElse(false);
            case "has-to-month-or-season" -> date(token, ctx)
                .map(value -> value.start().hasMonth() || value.start().hasSeason())
                .orElse(false);
            case "is-multiple" -> NumberFormatter.isMultiple(variables.value(token))
                || (Variables.isName(token) && variables.names(token).size() > 1);
            default -> false;
        };
    }

    private static boolean startsWithDigit(String value) {
        return value != null && !value.isEmpty() && Character.isDigit(value.charAt(0));
    }

    private static boolean isUncertainDate(String variable, RenderContext ctx) {
        var value = ctx.variables().value(variable);
        return value != null && DateParser.isUncertain(value);
    }

    private static Optional<DateValue> date(String variable, RenderContext ctx) {
        return DateParser.parse(ctx.variables().value(variable)).filter(value -> !value.isLiteral());
    }

    private static boolean position(String token, RenderContext ctx) {
        var position = ctx.position();
        if (ctx.target() == RenderTarget.BIBLIOGRAPHY) {
            return "first".equals(token);
        }
        return switch (token) {
            case "first" -> position == Position.FIRST;
            case "subsequent" -> position != Position.FIRST;
            case "ibid" -> position == Position.IBID || position == Position.IBID_WITH_LOCATOR;
            case "ibid-with-locator" -> position == Position.IBID_WITH_LOCATOR;
            case "near-note" -> position != Position.FIRST && isNear(ctx);
            case "far-note" -> position != Position.FIRST && !isNear(ctx);
            default -> false;
        };
    }

    private static boolean isNear(RenderContext ctx) {
        var note = ctx.noteNumber();
        var previous = ctx.previousNoteNumber();
        if (note == null || previous == null) {
            return false;
        }
        return note - previous <= ctx.nearNoteDistance();
    }

    private static boolean locator(String token, RenderContext ctx) {
        var item = ctx.item();
        if (item == null || !item.hasLocator()) {
            return false;
        }
        if ("true".equals(token)) {
            return true;
        }
        var label = item.label() == null || item.label().isBlank() ? "page" : item.label();
        return token.toLowerCase(Locale.ROOT).equals(label.toLowerCase(Locale.ROOT));
    }
}
