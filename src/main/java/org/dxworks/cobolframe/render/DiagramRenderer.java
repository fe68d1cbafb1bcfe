package org.dxworks.cobolframe.render;

import org.dxworks.cobolframe.model.cobol.CallGraph;

/**
 * Turns a call graph into the textual syntax of some diagram tool.
 */
public interface DiagramRenderer {
    String render(CallGraph graph);
}
