package org.dxworks.cobolframe.analyzer.cobol;

import java.util.List;

/**
 * Splits a division's text at {@code <name> SECTION.} headers.
 * A division without section headers comes back as a single {@code DEFAULT} segment.
 */
public final class SectionSegmenter {

    private SectionSegmenter() {}

    public static List<Segment> segment(String divisionText) {
        return SegmentSplitter.split(divisionText, CobolPatterns.SECTION);
    }
}
