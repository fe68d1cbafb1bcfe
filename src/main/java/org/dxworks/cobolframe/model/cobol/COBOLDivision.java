package org.dxworks.cobolframe.model.cobol;

import java.util.List;

public final class COBOLDivision {
    public static final String IDENTIFICATION = "IDENTIFICATION";
    public static final String ENVIRONMENT = "ENVIRONMENT";
    public static final String DATA = "DATA";
    public static final String PROCEDURE = "PROCEDURE";

    public final String name;
    public final String code;
    public final List<COBOLSection> sections;
    public final CallGraph callGraph; // PROCEDURE division only, null otherwise

    public COBOLDivision(String name, String code, List<COBOLSection> sections, CallGraph callGraph) {
        this.name = name;
        this.code = code;
        this.sections = List.copyOf(sections);
        this.callGraph = callGraph;
    }
}
