package org.dxworks.cobolframe.render;

import org.dxworks.cobolframe.model.cobol.CallEdge;
import org.dxworks.cobolframe.model.cobol.CallGraph;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Renders a call graph as a top-down Mermaid flowchart: edges first, then one
 * rounded node declaration per node so that targets without outgoing calls still appear.
 * <p>
 * Node ids are the names with Mermaid-hostile characters replaced by {@code _}; when two names
 * collapse to the same id the later one gets a numeric suffix.
 */
public class MermaidCallGraphRenderer implements DiagramRenderer {

    private static final String NL = "\n";
    private static final String INDENT = "    ";

    @Override
    public String render(CallGraph graph) {
        Objects.requireNonNull(graph, "graph");

        Map<String, String> ids = assignIds(graph);
        StringBuilder sb = new StringBuilder("graph TD;");
        for (CallEdge edge : graph.edges) {
            sb.append(NL).append(INDENT)
              .append(ids.get(edge.caller)).append(" --> ").append(ids.get(edge.callee)).append(';');
        }
        for (String node : graph.nodes) {
            sb.append(NL).append(INDENT)
              .append(ids.get(node)).append("([").append(label(node)).append("]);");
        }
        return sb.toString();
    }

    static Map<String, String> assignIds(CallGraph graph) {
        Map<String, String> ids = new HashMap<>();
        Set<String> taken = new HashSet<>();
        for (String node : graph.nodes) {
            assignId(node, ids, taken);
        }
        // edges built outside CallGraphBuilder may name nodes missing from the node list
        for (CallEdge edge : graph.edges) {
            assignId(edge.caller, ids, taken);
            assignId(edge.callee, ids, taken);
        }
        return ids;
    }

    private static void assignId(String name, Map<String, String> ids, Set<String> taken) {
        if (ids.containsKey(name)) return;
        String base = sanitize(name);
        String id = base;
        for (int suffix = 2; !taken.add(id); suffix++) {
            id = base + "_" + suffix;
        }
        ids.put(name, id);
    }

    // Mermaid ids may not contain '-' (read as part of an arrow)
    static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9_]", "_");
    }

    private static String label(String name) {
        return name.replace("\"", "#quot;");
    }
}
