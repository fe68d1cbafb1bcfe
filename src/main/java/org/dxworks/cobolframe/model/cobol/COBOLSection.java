package org.dxworks.cobolframe.model.cobol;

import java.util.List;

public final class COBOLSection {
    public final String name;
    public final String code;
    public final List<COBOLParagraph> paragraphs;

    public COBOLSection(String name, String code, List<COBOLParagraph> paragraphs) {
        this.name = name;
        this.code = code;
        this.paragraphs = List.copyOf(paragraphs);
    }
}
