package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.model.cobol.COBOLDivision;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits normalized program text into one segment per division header.
 * Text ahead of the first division header is dropped.
 */
public final class DivisionSegmenter {

    private DivisionSegmenter() {}

    public static List<Segment> segment(String programText) {
        List<Segment> divisions = new ArrayList<>();
        for (Segment segment : SegmentSplitter.split(programText, CobolPatterns.DIVISION)) {
            if (segment.kind == SegmentKind.HEADER) continue;
            if (segment.kind == SegmentKind.DEFAULT) {
                divisions.add(segment);
                continue;
            }
            divisions.add(Segment.named(canonicalName(segment.name), segment.boundary, segment.code));
        }
        return divisions;
    }

    static String canonicalName(String headerName) {
        if (headerName.startsWith(COBOLDivision.PROCEDURE)) {
            return COBOLDivision.PROCEDURE;
        }
        if ("ID".equals(headerName)) {
            return COBOLDivision.IDENTIFICATION;
        }
        return headerName;
    }
}
