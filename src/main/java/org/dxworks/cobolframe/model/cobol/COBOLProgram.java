package org.dxworks.cobolframe.model.cobol;

import java.util.List;

/**
 * Structural model of one COBOL source file: divisions, their sections and,
 * in the procedure division, paragraphs with the calls they make.
 */
public final class COBOLProgram {
    public static final String UNKNOWN_PROGRAM = "UNKNOWN";

    public final String filePath;
    public final String language = "cobol";
    public final String programName;
    public final String content; // normalized source
    public final List<COBOLDivision> divisions;

    public COBOLProgram(String filePath, String programName, String content, List<COBOLDivision> divisions) {
        this.filePath = filePath;
        this.programName = programName;
        this.content = content;
        this.divisions = List.copyOf(divisions);
    }
}
