package org.dxworks.cobolframe.model.cobol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Name-keyed call graph of a procedure division. Nodes are paragraph names and
 * call targets; edges are caller/callee pairs, one per extracted call.
 * Targets that no paragraph defines are kept as nodes and listed in {@link #danglingTargets}.
 */
public final class CallGraph {
    public final List<String> nodes;
    public final List<CallEdge> edges;
    public final List<String> danglingTargets;

    public CallGraph(List<String> nodes, List<CallEdge> edges, List<String> danglingTargets) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.danglingTargets = List.copyOf(danglingTargets);
    }

    /** Distinct callees of {@code name}, in edge order. */
    public List<String> successors(String name) {
        Set<String> result = new LinkedHashSet<>();
        for (CallEdge edge : edges) {
            if (edge.caller.equals(name)) {
                result.add(edge.callee);
            }
        }
        return new ArrayList<>(result);
    }

    /** Distinct callers of {@code name}, in edge order. */
    public List<String> predecessors(String name) {
        Set<String> result = new LinkedHashSet<>();
        for (CallEdge edge : edges) {
            if (edge.callee.equals(name)) {
                result.add(edge.caller);
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Every node reachable from {@code start} through one or more edges, breadth first.
     * {@code start} itself is included only when it lies on a cycle.
     */
    public List<String> reachableFrom(String start) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(successors(start));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (visited.add(current)) {
                queue.addAll(successors(current));
            }
        }
        return new ArrayList<>(visited);
    }
}
