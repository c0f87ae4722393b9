package work.citeproc.engine.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.citeproc.engine.locale.TermForm;
import work.citeproc.engine.output.Formatting;
import work.citeproc.engine.output.Output;

/**
 * Applies an element's formatting attributes to its already rendered content, in the fixed order text-case,
 * strip-periods, quotes, font, affixes, display.
 */
public final class Decorations {
    private Decorations() {}

    public static Output apply(Map<String, String> attributes, Output content, RenderContext ctx) {
        return apply(attributes, content, ctx, true);
    }

    public static Output apply(Map<String, String> attributes, Output content, RenderContext ctx, boolean withAffixes) {
        if (content.isEmpty()) {
            return Output.EMPTY;
        }
        var result = content;
        var textCase = attributes.get("text-case");
        if (textCase != null) {
            result = mapLeaves(result, textCase, new boolean[] {true});
        }
        if ("true".equals(attributes.get("strip-periods"))) {
            result = stripPeriods(result);
        }
        var suffix = withAffixes ? attributes.getOrDefault("suffix", "") : "";
        if ("true".equals(attributes.get("quotes"))) {
            var open = ctx.locale().term("open-quote", TermForm.LONG, false);
            var close = ctx.locale().term("close-quote", TermForm.LONG, false);
            var inner = "";
            if (ctx.locale().option("punctuation-in-quote") && (suffix.startsWith(".") || suffix.startsWith(","))) {
                inner = suffix.substring(0, 1);
                suffix = suffix.substring(1);
            }
            result = Output.seq(Output.text(open.isEmpty() ? "\"" : open), result, Output.text(inner),
                Output.text(close.isEmpty() ? "\"" : close));
        }
        var formatting = Formatting.from(attributes);
        result = Output.styled(formatting.withoutDisplay(), result);
        if (withAffixes) {
            result = Output.seq(Output.text(attributes.get("prefix")), result, Output.text(suffix));
        }
        if (formatting.display() != null) {
            result = Output.styled(formatting.displayOnly(), result);
        }
        return result;
    }

    static Output stripPeriods(Output output) {
        if (output instanceof Output.Text text) {
            return Output.text(text.value().replace(".", ""));
        }
        if (output instanceof Output.Styled styled) {
            return Output.styled(styled.formatting(), stripPeriods(styled.content()));
        }
        var parts = new ArrayList<Output>();
        for (var part : ((Output.Seq) output).parts()) {
            parts.add(stripPeriods(part));
        }
        return Output.seq(parts);
    }

    // text-case never reaches into nested formatted content
    private static Output mapLeaves(Output output, String mode, boolean[] first) {
        if (output instanceof Output.Text text) {
            var value = TextCase.apply(mode, text.value(), first[0]);
            first[0] = false;
            return Output.text(value);
        }
        if (output instanceof Output.Styled) {
            first[0] = false;
            return output;
        }
        List<Output> parts = new ArrayList<>();
        for (var part : ((Output.Seq) output).parts()) {
            parts.add(mapLeaves(part, mode, first));
        }
        return Output.seq(parts);
    }
}
