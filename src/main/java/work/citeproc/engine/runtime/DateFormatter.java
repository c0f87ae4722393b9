package work.citeproc.engine.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import work.citeproc.engine.locale.TermForm;
import work.citeproc.engine.output.Output;
import work.citeproc.engine.style.Node;
import work.citeproc.engine.style.NodeKind;

/**
 * Renders {@code <date>} elements, either from their own {@code <date-part>} children or from the localized
 * {@code text}/{@code numeric} formats.
 */
public final class DateFormatter {
    private static final Set<String> LOCAL_ONLY = Set.of("prefix", "suffix");

    private DateFormatter() {}

    /**
     * @param yearSuffix letter appended right after the year, or an empty string
     * @return the date without the element's own formatting; the caller decorates it
     */
    public static Output format(Node date, DateValue value, RenderContext ctx, String yearSuffix) {
        if (value.isLiteral()) {
            return Output.text(value.literal());
        }
        var layout = layout(date, ctx);
        var parts = layout.parts();
        if (parts.isEmpty()) {
            return Output.EMPTY;
        }
        if (value.isRange()) {
            return range(parts, value.start(), value.end(), layout.delimiter(), ctx, yearSuffix);
        }
        return single(parts, value.start(), layout.delimiter(), ctx, yearSuffix, false);
    }

    /**
     * Resolves the date-part list of a date element, merging a localized format with the element's overrides.
     */
    static DateLayout layout(Node date, RenderContext ctx) {
        var form = date.attr("form");
        if (form == null) {
            return new DateLayout(date.children(NodeKind.DATE_PART), date.attr("delimiter", ""));
        }
        var localized = ctx.locale().dateFormat(form).orElse(null);
        if (localized == null) {
            return new DateLayout(date.children(NodeKind.DATE_PART), date.attr("delimiter", ""));
        }
        var wanted = date.attr("date-parts", "year-month-day");
        var overrides = new LinkedHashMap<String, Node>();
        for (var part : date.children(NodeKind.DATE_PART)) {
            overrides.put(part.attr("name"), part);
        }
        var parts = new ArrayList<Node>();
        for (var part : localized.children(NodeKind.DATE_PART)) {
            var name = part.attr("name");
            if (!included(name, wanted)) {
                continue;
            }
            var override = overrides.get(name);
            if (override == null) {
                parts.add(part);
                continue;
            }
            var merged = new LinkedHashMap<>(part.attributes());
            override.attributes().forEach((key, val) -> {
                if (!LOCAL_ONLY.contains(key)) {
                    merged.put(key, val);
                }
            });
            parts.add(new Node(NodeKind.DATE_PART, merged, List.of()));
        }
        return new DateLayout(parts, localized.attr("delimiter", ""));
    }

    private static boolean included(String part, String wanted) {
        return switch (wanted) {
            case "year" -> "year".equals(part);
            case "year-month" -> "year".equals(part) || "month".equals(part);
            default -> true;
        };
    }

    private static Output single(List<Node> parts, DateValue.Parts date, String delimiter, RenderContext ctx,
                                 String yearSuffix, boolean dropLastSuffix) {
        var rendered = new ArrayList<Output>();
        var present = new ArrayList<Node>();
        for (var part : parts) {
            if (hasValue(part, date)) {
                present.add(part);
            }
        }
        for (int i = 0; i < present.size(); i++) {
            var part = present.get(i);
            var attributes = part.attributes();
            if (dropLastSuffix && i == present.size() - 1) {
                attributes = new LinkedHashMap<>(attributes);
                attributes.remove("suffix");
            }
            var content = Output.text(partText(part, date, ctx));
            if ("year".equals(part.attr("name")) && !yearSuffix.isEmpty()) {
                content = Output.seq(content, Output.text(yearSuffix));
            }
            rendered.add(Decorations.apply(attributes, content, ctx));
        }
        return Output.join(rendered, delimiter);
    }

    private static Output range(List<Node> parts, DateValue.Parts start, DateValue.Parts end, String delimiter,
                                RenderContext ctx, String yearSuffix) {
        var differing = start.year() != end.year() ? "year" : start.month() != end.month() ? "month" : "day";
        var rangeDelimiter = rangeDelimiter(parts, differing);
        if ("year".equals(differing)) {
            return Output.seq(single(parts, start, delimiter, ctx, "", true), Output.text(rangeDelimiter),
                single(parts, end, delimiter, ctx, yearSuffix, false));
        }
        // parts at or below the differing granularity form the ranged run; the others render once
        var ranged = new ArrayList<Node>();
        var before = new ArrayList<Node>();
        var after = new ArrayList<Node>();
        for (var part : parts) {
            var name = part.attr("name");
            boolean inRun = "day".equals(name) || ("month".equals(name) && "month".equals(differing));
            if (inRun) {
                ranged.add(part);
            } else if (ranged.isEmpty()) {
                before.add(part);
            } else {
                after.add(part);
            }
        }
        var pieces = new ArrayList<Output>();
        pieces.add(single(before, start, delimiter, ctx, yearSuffix, false));
        pieces.add(Output.seq(single(ranged, start, delimiter, ctx, "", true), Output.text(rangeDelimiter),
            single(ranged, end, delimiter, ctx, "", false)));
        pieces.add(single(after, start, delimiter, ctx, yearSuffix, false));
        return Output.join(pieces, delimiter);
    }

    private static String rangeDelimiter(List<Node> parts, String name) {
        for (var part : parts) {
            if (name.equals(part.attr("name"))) {
                return part.attr("range-delimiter", "–");
            }
        }
        return "–";
    }

    private static boolean hasValue(Node part, DateValue.Parts date) {
        return switch (part.attr("name", "")) {
            case "year" -> date.year() != 0;
            case "month" -> date.hasMonth() || date.hasSeason();
            case "day" -> date.hasDay();
            default -> false;
        };
    }

    static String partText(Node part, DateValue.Parts date, RenderContext ctx) {
        var form = part.attr("form");
        return switch (part.attr("name", "")) {
            case "year" -> year(date.year(), form);
            case "month" -> month(date, form, ctx);
            case "day" -> day(date, form, ctx);
            default -> "";
        };
    }

    private static String year(int year, String form) {
        if (year == 0) {
            return "";
        }
        if (year < 0) {
            return (-year) + "BC";
        }
        if (year < 1000) {
            return year + "AD";
        }
        if ("short".equals(form)) {
            return String.format(Locale.ROOT, "%02d", year % 100);
        }
        return Integer.toString(year);
    }

    private static String month(DateValue.Parts date, String form, RenderContext ctx) {
        if (date.hasSeason()) {
            return ctx.locale().season(date.season());
        }
        if (!date.hasMonth()) {
            return "";
        }
        var chosen = form == null ? "long" : form;
        return switch (chosen) {
            case "numeric" -> Integer.toString(date.month());
            case "numeric-leading-zeros" -> String.format(Locale.ROOT, "%02d", date.month());
            case "short" -> ctx.locale().month(date.month(), TermForm.SHORT);
            default -> ctx.locale().month(date.month(), TermForm.LONG);
        };
    }

    private static String day(DateValue.Parts date, String form, RenderContext ctx) {
        if (!date.hasDay()) {
            return "";
        }
        var chosen = form == null ? "numeric" : form;
        return switch (chosen) {
            case "numeric-leading-zeros" -> String.format(Locale.ROOT, "%02d", date.day());
            case "ordinal" -> {
                if (date.day() != 1 && ctx.locale().option("limit-day-ordinals-to-day-1")) {
                    yield Integer.toString(date.day());
                }
                var gender = ctx.locale().gender(String.format(Locale.ROOT, "month-%02d", date.month())).orElse(null);
                yield ctx.locale().ordinal(date.day(), gender);
            }
            default -> Integer.toString(date.day());
        };
    }

    /**
     * Date-part list of a resolved date element and the delimiter between its parts.
     */
    record DateLayout(List<Node> parts, String delimiter) {}
}
