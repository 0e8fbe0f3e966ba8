package com.vidnyan.semacro.domain.graph;

import java.util.*;

/**
 * Bounded callee subgraph rooted at one macro, discovered breadth-first.
 * Rendering to DOT or Mermaid is done by {@link GraphRenderer} over this one structure.
 */
public final class DependencyGraph {

    private final String start;
    private final int maxDepth;
    private final Map<String, Integer> nodes;              // macro → BFS depth, discovery order
    private final List<CallEdge> edges;                    // discovery order
    private final Map<String, Set<String>> dependencies;   // macro → macros it calls

    private DependencyGraph(String start, int maxDepth, Map<String, Integer> nodes, List<CallEdge> edges) {
        this.start = start;
        this.maxDepth = maxDepth;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = List.copyOf(edges);
        Map<String, Set<String>> deps = new LinkedHashMap<>();
        for (CallEdge edge : edges) {
            deps.computeIfAbsent(edge.caller(), k -> new LinkedHashSet<>()).add(edge.callee());
        }
        this.dependencies = Collections.unmodifiableMap(deps);
    }

    /**
     * Walk callee edges from {@code start} for at most {@code maxDepth} hops.
     * Nodes at depth {@code maxDepth} are included but their callees are not.
     */
    public static DependencyGraph build(CallGraph callGraph, String start, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        Map<String, Integer> nodes = new LinkedHashMap<>();
        List<CallEdge> edges = new ArrayList<>();
        Queue<String> queue = new LinkedList<>();
        nodes.put(start, 0);
        queue.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int depth = nodes.get(current);
            if (depth >= maxDepth) {
                continue;
            }
            for (CallEdge edge : callGraph.getOutgoingCalls(current)) {
                edges.add(edge);
                if (!nodes.containsKey(edge.callee())) {
                    nodes.put(edge.callee(), depth + 1);
                    queue.add(edge.callee());
                }
            }
        }

        return new DependencyGraph(start, maxDepth, nodes, edges);
    }

    public String getStart() {
        return start;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Get node names with their BFS depth, in discovery order.
     */
    public Map<String, Integer> getNodes() {
        return nodes;
    }

    public List<CallEdge> getEdges() {
        return edges;
    }

    /**
     * Get macros that a macro calls within this subgraph.
     */
    public Set<String> getDependencies(String name) {
        return dependencies.getOrDefault(name, Set.of());
    }

    /**
     * Check if there are any cycles in the discovered subgraph.
     */
    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    /**
     * Find all cycles in the discovered subgraph.
     * Returns list of cycles, where each cycle is a list of macro names ending where it started.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();

        for (String node : nodes.keySet()) {
            if (!visited.contains(node)) {
                findCyclesRecursive(node, visited, inStack, new ArrayList<>(), cycles);
            }
        }

        return cycles;
    }

    private void findCyclesRecursive(
            String current,
            Set<String> visited,
            Set<String> inStack,
            List<String> path,
            List<List<String>> cycles
    ) {
        visited.add(current);
        inStack.add(current);
        path.add(current);

        for (String dep : getDependencies(current)) {
            if (!visited.contains(dep)) {
                findCyclesRecursive(dep, visited, inStack, path, cycles);
            } else if (inStack.contains(dep)) {
                int cycleStart = path.indexOf(dep);
                List<String> cycle = new ArrayList<>(path.subList(cycleStart, path.size()));
                cycle.add(dep);
                cycles.add(cycle);
            }
        }

        path.remove(path.size() - 1);
        inStack.remove(current);
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        return new Stats(nodes.size(), edges.size());
    }

    public record Stats(int nodeCount, int edgeCount) {}
}
