package com.vidnyan.semacro.domain.graph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Formats a {@link DependencyGraph} as a DOT or Mermaid document.
 * Pure formatting: node and edge order follow the graph's discovery order.
 */
public final class GraphRenderer {

    private GraphRenderer() {
    }

    public static String render(DependencyGraph graph, GraphFormat format) {
        return switch (format) {
            case DOT -> renderDot(graph);
            case MERMAID -> renderMermaid(graph);
        };
    }

    static String renderDot(DependencyGraph graph) {
        StringJoiner out = new StringJoiner("\n", "", "\n");
        out.add("digraph " + quote(graph.getStart()) + " {");
        out.add("    rankdir=LR;");
        out.add("    node [shape=box];");
        for (List<String> cycle : graph.findCycles()) {
            out.add("    // cycle: " + String.join(" -> ", cycle));
        }
        graph.getNodes().forEach((name, depth) -> {
            String attributes = depth == 0 ? " [style=bold]" : "";
            out.add("    " + quote(name) + attributes + ";");
        });
        for (CallEdge edge : graph.getEdges()) {
            out.add("    " + quote(edge.caller()) + " -> " + quote(edge.callee()) + ";");
        }
        out.add("}");
        return out.toString();
    }

    static String renderMermaid(DependencyGraph graph) {
        // Mermaid ids must be plain tokens; macro names are kept as labels
        Map<String, String> ids = new HashMap<>();
        int counter = 0;
        for (String name : graph.getNodes().keySet()) {
            ids.put(name, "n" + counter++);
        }

        StringJoiner out = new StringJoiner("\n", "", "\n");
        out.add("graph LR");
        for (List<String> cycle : graph.findCycles()) {
            out.add("    %% cycle: " + String.join(" -> ", cycle));
        }
        graph.getNodes().keySet().forEach(name -> out.add("    " + ids.get(name) + "[\"" + name + "\"]"));
        for (CallEdge edge : graph.getEdges()) {
            out.add("    " + ids.get(edge.caller()) + " --> " + ids.get(edge.callee()));
        }
        return out.toString();
    }

    private static String quote(String name) {
        return "\"" + name.replace("\"", "\\\"") + "\"";
    }
}
