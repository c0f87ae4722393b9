package work.citeproc.engine.sort;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import work.citeproc.engine.data.CiteItem;
import work.citeproc.engine.data.Entry;
import work.citeproc.engine.data.Name;
import work.citeproc.engine.data.VariableAccessor;
import work.citeproc.engine.data.Variables;
import work.citeproc.engine.locale.LocaleResolver;
import work.citeproc.engine.runtime.DateParser;
import work.citeproc.engine.runtime.Interpreter;
import work.citeproc.engine.runtime.NumberFormatter;
import work.citeproc.engine.runtime.RenderContext;
import work.citeproc.engine.runtime.RenderTarget;
import work.citeproc.engine.runtime.SortNameOptions;
import work.citeproc.engine.style.Definition;
import work.citeproc.engine.style.SortKeySpec;
import work.citeproc.engine.style.Style;

/**
 * Orders the bibliography and the items of a citation cluster by the style's {@code <sort>} keys.
 */
public final class SortEngine {
    private final Style style;
    private final LocaleResolver locale;
    private final Collator collator;

    public SortEngine(Style style, LocaleResolver locale) {
        this.style = style;
        this.locale = locale;
        this.collator = Collator.getInstance(locale.javaLocale());
    }

    /**
     * Numeric styles without their own keys keep first-cite order; everything else sorts by the bibliography
     * keys. The sort is stable.
     *
     * @param citeOrder entry id to first-cite position (0-based)
     */
    public List<Entry> sortBibliography(List<Entry> entries, Map<String, Integer> citeOrder) {
        var definition = style.bibliography().orElse(null);
        var ordered = new ArrayList<>(entries);
        Function<Entry, Integer> order = entry -> citeOrder.getOrDefault(entry.id(), Integer.MAX_VALUE);
        if (definition == null || definition.sortKeys().isEmpty() || numberedByCiteOrder(definition)) {
            ordered.sort(Comparator.comparing(order));
            return ordered;
        }
        var keys = new IdentityHashMap<Entry, SortKey>();
        for (int i = 0; i < ordered.size(); i++) {
            var entry = ordered.get(i);
            int position = citeOrder.getOrDefault(entry.id(), citeOrder.size() + i);
            keys.put(entry, key(entry, definition, RenderTarget.BIBLIOGRAPHY, position, position + 1));
        }
        ordered.sort((left, right) -> compare(keys.get(left), keys.get(right), definition.sortKeys()));
        return ordered;
    }

    private boolean numberedByCiteOrder(Definition definition) {
        if (!style.referencesVariable("citation-number")) {
            return false;
        }
        for (var spec : definition.sortKeys()) {
            if ("citation-number".equals(spec.variable())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sorts the items of one cluster by the {@code <citation>} keys. Without keys the order is kept.
     *
     * @param citationNumbers entry id to assigned citation number
     */
    public List<CiteItem> sortCluster(List<CiteItem> items, Map<String, Entry> entries, Map<String, Integer> citationNumbers) {
        var definition = style.citation();
        if (definition.sortKeys().isEmpty() || items.size() < 2) {
            return items;
        }
        var keyed = new ArrayList<SortKey>();
        for (int i = 0; i < items.size(); i++) {
            var entry = entries.get(items.get(i).id());
            if (entry == null) {
                keyed.add(new SortKey(items.get(i).id(), List.of(), i));
                continue;
            }
            var number = citationNumbers.getOrDefault(entry.id(), i + 1);
            var key = key(entry, definition, RenderTarget.CITATION, i, number);
            keyed.add(new SortKey(items.get(i).id(), key.values(), i));
        }
        keyed.sort((left, right) -> compare(left, right, definition.sortKeys()));
        var sorted = new ArrayList<CiteItem>(items.size());
        for (var key : keyed) {
            sorted.add(items.get(key.citeOrder()));
        }
        return sorted;
    }

    SortKey key(Entry entry, Definition definition, RenderTarget target, int citeOrder, int citationNumber) {
        var values = new ArrayList<String>();
        for (var spec : definition.sortKeys()) {
            values.add(spec.isMacro()
                ? macroValue(entry, spec, target, citationNumber)
                : variableValue(entry, spec.variable(), citationNumber));
        }
        return new SortKey(entry.id(), values, citeOrder);
    }

    private String macroValue(Entry entry, SortKeySpec spec, RenderTarget target, int citationNumber) {
        var body = style.macro(spec.macro());
        if (body == null) {
            return "";
        }
        var useLast = spec.attributes().get("names-use-last");
        var options = new SortNameOptions(spec.intAttr("names-min"), spec.intAttr("names-use-first"),
            useLast == null ? null : Boolean.valueOf(useLast));
        var ctx = RenderContext.builder(style, entry, locale)
            .target(target)
            .citationNumber(citationNumber)
            .sortNameOptions(options)
            .build();
        return Interpreter.render(body, ctx).plainText().trim();
    }

    private String variableValue(Entry entry, String variable, int citationNumber) {
        if (variable == null) {
            return "";
        }
        if ("citation-number".equals(variable)) {
            return pad(citationNumber);
        }
        var accessor = new VariableAccessor(entry, Map.of());
        if (Variables.isName(variable)) {
            return names(accessor.names(variable));
        }
        var value = accessor.value(variable);
        if (value == null) {
            return "";
        }
        if (Variables.isDate(variable)) {
            return DateParser.parse(value)
                .filter(date -> !date.isLiteral())
                .map(date -> String.format(Locale.ROOT, "%05d%02d%02d",
                    date.start().year() + 10000, date.start().month(), date.start().day()))
                .orElse("");
        }
        if (Variables.isNumber(variable) && NumberFormatter.isNumeric(value)) {
            var digits = value.replaceAll("^\\D*(\\d+).*$", "$1");
            try {
                return pad(Integer.parseInt(digits));
            } catch (NumberFormatException ex) {
                return value;
            }
        }
        return value;
    }

    private String names(List<Name> names) {
        var keys = new ArrayList<String>();
        boolean demote = !"never".equals(style.option("demote-non-dropping-particle"));
        for (var name : names) {
            var family = demote ? name.sortFamily() : name.familyWithParticle();
            var given = name.given() == null ? "" : name.given();
            keys.add((family + " " + given).trim());
        }
        return String.join(", ", keys);
    }

    private int compare(SortKey left, SortKey right, List<SortKeySpec> specs) {
        for (int i = 0; i < specs.size(); i++) {
            var a = i < left.values().size() ? left.values().get(i) : "";
            var b = i < right.values().size() ? right.values().get(i) : "";
            if (a.isEmpty() || b.isEmpty()) {
                if (a.isEmpty() != b.isEmpty()) {
                    return a.isEmpty() ? 1 : -1;
                }
                continue;
            }
            int result = collator.compare(a, b);
            if (result != 0) {
                return specs.get(i).descending() ? -result : result;
            }
        }
        return Integer.compare(left.citeOrder(), right.citeOrder());
    }

    private static String pad(int number) {
        return String.format(Locale.ROOT, "%010d", number);
    }
}
