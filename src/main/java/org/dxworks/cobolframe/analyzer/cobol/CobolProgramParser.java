package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.analyzer.cobol.preprocessor.CobolLineNormalizer;
import org.dxworks.cobolframe.analyzer.cobol.preprocessor.SourceFormat;
import org.dxworks.cobolframe.model.cobol.COBOLDivision;
import org.dxworks.cobolframe.model.cobol.COBOLParagraph;
import org.dxworks.cobolframe.model.cobol.COBOLProgram;
import org.dxworks.cobolframe.model.cobol.COBOLSection;
import org.dxworks.cobolframe.model.cobol.CallGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Recovers the Program / Division / Section / Paragraph structure of one COBOL source file
 * and the call graph of its procedure division.
 * <p>
 * Parsing never fails on malformed input: missing boundaries degrade to {@code DEFAULT}
 * and {@code HEADER} segments. Instances are immutable and may be shared between threads.
 */
public class CobolProgramParser {

    private static final Logger log = LoggerFactory.getLogger(CobolProgramParser.class);

    private final SourceFormat sourceFormat;
    private final ParagraphSegmenter paragraphSegmenter;

    public CobolProgramParser(SourceFormat sourceFormat, CallExtractor callExtractor) {
        this.sourceFormat = Objects.requireNonNull(sourceFormat, "sourceFormat");
        this.paragraphSegmenter = new ParagraphSegmenter(callExtractor);
    }

    public CobolProgramParser() {
        this(SourceFormat.AUTO, CallExtractor.performOnly());
    }

    public COBOLProgram parse(String filePath, String sourceCode) {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(sourceCode, "sourceCode");

        String content = CobolLineNormalizer.normalize(sourceCode, sourceFormat);
        String programName = extractProgramName(content);

        List<COBOLDivision> divisions = new ArrayList<>();
        for (Segment divisionSegment : DivisionSegmenter.segment(content)) {
            if (divisionSegment.kind == SegmentKind.DEFAULT) {
                log.debug("No division headers in {}, keeping the whole text as {}", filePath, divisionSegment.name);
            }
            divisions.add(buildDivision(filePath, divisionSegment));
        }

        return new COBOLProgram(filePath, programName, content, divisions);
    }

    static String extractProgramName(String content) {
        Matcher matcher = CobolPatterns.PROGRAM_ID.matcher(content);
        if (matcher.find()) {
            return matcher.group(1).toUpperCase(Locale.ROOT);
        }
        return COBOLProgram.UNKNOWN_PROGRAM;
    }

    private COBOLDivision buildDivision(String filePath, Segment divisionSegment) {
        boolean procedure = COBOLDivision.PROCEDURE.equals(divisionSegment.name);

        List<COBOLSection> sections = new ArrayList<>();
        for (Segment sectionSegment : SectionSegmenter.segment(divisionSegment.code)) {
            if (sectionSegment.kind == SegmentKind.DEFAULT) {
                log.debug("No section headers in {} division of {}", divisionSegment.name, filePath);
            }
            List<COBOLParagraph> paragraphs = procedure
                    ? paragraphSegmenter.segment(sectionSegment.name, sectionSegment.code)
                    : List.of();
            sections.add(new COBOLSection(sectionSegment.name, sectionSegment.code, paragraphs));
        }

        CallGraph callGraph = procedure ? CallGraphBuilder.build(sections) : null;
        if (callGraph != null && !callGraph.danglingTargets.isEmpty()) {
            log.debug("Calls to undefined paragraphs in {}: {}", filePath, callGraph.danglingTargets);
        }
        return new COBOLDivision(divisionSegment.name, divisionSegment.code, sections, callGraph);
    }
}
