package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.model.cobol.COBOLParagraph;
import org.dxworks.cobolframe.model.cobol.COBOLSection;
import org.dxworks.cobolframe.model.cobol.CallEdge;
import org.dxworks.cobolframe.model.cobol.CallGraph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregates the calls of every paragraph in a procedure division into a {@link CallGraph}.
 */
public final class CallGraphBuilder {

    private CallGraphBuilder() {}

    public static CallGraph build(List<COBOLSection> sections) {
        Set<String> defined = new LinkedHashSet<>();
        List<CallEdge> edges = new ArrayList<>();

        for (COBOLSection section : sections) {
            for (COBOLParagraph paragraph : section.paragraphs) {
                defined.add(paragraph.name);
                for (String target : paragraph.calls) {
                    edges.add(new CallEdge(paragraph.name, target));
                }
            }
        }

        Set<String> nodes = new LinkedHashSet<>(defined);
        Set<String> dangling = new LinkedHashSet<>();
        for (CallEdge edge : edges) {
            nodes.add(edge.callee);
            if (!defined.contains(edge.callee)) {
                dangling.add(edge.callee);
            }
        }

        return new CallGraph(new ArrayList<>(nodes), edges, new ArrayList<>(dangling));
    }
}
