package work.citeproc.engine.style;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Size and nesting figures of a parsed style.
 *
 * @param maxDepth deepest element nesting inside any macro or layout, layouts and macro bodies counting as depth 1
 * @param macroCalls {@code <text macro="...">} call sites across macros and layouts
 */
public record StyleMetrics(int macroCount, int maxDepth, int totalNodes, int macroCalls) {
    public static StyleMetrics analyze(Style style) {
        var counter = new Counter();
        for (var body : style.macros().values()) {
            counter.visit(body, 1);
        }
        visit(style.citation(), counter);
        style.bibliography().ifPresent(definition -> visit(definition, counter));
        return new StyleMetrics(style.macros().size(), counter.maxDepth, counter.nodes, counter.calls);
    }

    private static void visit(Definition definition, Counter counter) {
        for (var layout : definition.layouts()) {
            counter.visit(layout.children(), 1);
        }
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("macros", macroCount);
        map.put("maxDepth", maxDepth);
        map.put("nodes", totalNodes);
        map.put("macroCalls", macroCalls);
        return map;
    }

    private static final class Counter {
        private int maxDepth;
        private int nodes;
        private int calls;

        void visit(List<Node> children, int depth) {
            for (var node : children) {
                nodes++;
                maxDepth = Math.max(maxDepth, depth);
                if (node.kind() == NodeKind.TEXT && node.has("macro")) {
                    calls++;
                }
                visit(node.children(), depth + 1);
            }
        }
    }
}
