package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.model.cobol.COBOLParagraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a procedure-division section into paragraphs and extracts the calls each one makes.
 * <p>
 * Text before the first paragraph header (or the whole section, when it has no header)
 * becomes a paragraph named {@code <section>-HEADER} if it is not blank, and is dropped otherwise.
 * A lone {@code EXIT.}, {@code GOBACK.}, {@code CONTINUE.} or {@code END-xxx.} line never starts a
 * paragraph, and the call lists follow the filtering rules of {@link CallExtractor}.
 */
public final class ParagraphSegmenter {

    public static final String HEADER_SUFFIX = "-HEADER";

    private final CallExtractor callExtractor;

    public ParagraphSegmenter(CallExtractor callExtractor) {
        this.callExtractor = Objects.requireNonNull(callExtractor, "callExtractor");
    }

    public List<COBOLParagraph> segment(String sectionName, String sectionText) {
        List<Segment> segments = SegmentSplitter.split(sectionText, CobolPatterns.PARAGRAPH);
        List<COBOLParagraph> paragraphs = new ArrayList<>(segments.size());

        for (Segment segment : segments) {
            if (segment.kind.isSentinel()) {
                if (!segment.code.isBlank()) {
                    paragraphs.add(toParagraph(sectionName + HEADER_SUFFIX, segment.code));
                }
                continue;
            }
            paragraphs.add(toParagraph(segment.name, segment.code));
        }
        return paragraphs;
    }

    private COBOLParagraph toParagraph(String name, String code) {
        return new COBOLParagraph(name, code, callExtractor.extract(code));
    }
}
