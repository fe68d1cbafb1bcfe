package org.dxworks.cobolframe.model.cobol;

import java.util.List;

public final class COBOLParagraph {
    public final String name;
    public final String code;
    public final List<String> calls; // uppercased targets, text order, duplicates kept

    public COBOLParagraph(String name, String code, List<String> calls) {
        this.name = name;
        this.code = code;
        this.calls = List.copyOf(calls);
    }
}
