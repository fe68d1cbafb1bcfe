package org.dxworks.cobolframe.analyzer.cobol;

import org.dxworks.cobolframe.analyzer.cobol.preprocessor.SourceFormat;
import org.dxworks.cobolframe.model.cobol.COBOLDivision;
import org.dxworks.cobolframe.model.cobol.COBOLParagraph;
import org.dxworks.cobolframe.model.cobol.COBOLProgram;
import org.dxworks.cobolframe.model.cobol.COBOLSection;
import org.dxworks.cobolframe.model.cobol.CallEdge;
import org.dxworks.cobolframe.model.cobol.CallGraph;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CobolProgramParserTest {

    private final CobolProgramParser parser = new CobolProgramParser();

    private static List<String> divisionNames(COBOLProgram program) {
        return program.divisions.stream().map(d -> d.name).collect(Collectors.toList());
    }

    private static COBOLDivision procedure(COBOLProgram program) {
        return program.divisions.stream()
                .filter(d -> COBOLDivision.PROCEDURE.equals(d.name))
                .findFirst()
                .orElseThrow();
    }

    private static List<COBOLParagraph> paragraphs(COBOLDivision division) {
        return division.sections.stream()
                .flatMap(s -> s.paragraphs.stream())
                .collect(Collectors.toList());
    }

    @Test
    void numberedIdentificationDivision_givesProgramNameAndOneDivision() {
        COBOLProgram program = parser.parse("foo.cbl", "123456 IDENTIFICATION DIVISION.\n123456 PROGRAM-ID. FOO.\n");

        assertEquals("foo.cbl", program.filePath);
        assertEquals("FOO", program.programName);
        assertEquals(List.of("IDENTIFICATION"), divisionNames(program));

        COBOLDivision identification = program.divisions.get(0);
        assertEquals("PROGRAM-ID. FOO.", identification.code);
        assertEquals(1, identification.sections.size());
        assertEquals("DEFAULT", identification.sections.get(0).name);
        assertTrue(identification.sections.get(0).paragraphs.isEmpty());
        assertNull(identification.callGraph);
    }

    @Test
    void procedureParagraphs_andTheirCallGraph() {
        String source = String.join("\n",
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DEMO.",
                "PROCEDURE DIVISION.",
                "MAIN-PARA.",
                "    PERFORM SUB-PARA.",
                "SUB-PARA.",
                "    DISPLAY 'X'.");

        COBOLProgram program = parser.parse("demo.cbl", source);
        COBOLDivision procedure = procedure(program);
        List<COBOLParagraph> paragraphs = paragraphs(procedure);

        assertEquals(List.of("MAIN-PARA", "SUB-PARA"), paragraphs.stream().map(p -> p.name).collect(Collectors.toList()));
        assertEquals(List.of("SUB-PARA"), paragraphs.get(0).calls);

        CallGraph graph = procedure.callGraph;
        assertNotNull(graph);
        assertEquals(List.of("MAIN-PARA", "SUB-PARA"), graph.nodes);
        assertEquals(List.of(new CallEdge("MAIN-PARA", "SUB-PARA")), graph.edges);
    }

    @Test
    void callToUndefinedParagraph_isADanglingNode() {
        String source = "PROCEDURE DIVISION.\nMAIN-PARA.\n    PERFORM GHOST-PARA.\n    STOP RUN.";

        CallGraph graph = procedure(parser.parse("ghost.cbl", source)).callGraph;

        assertTrue(graph.nodes.contains("GHOST-PARA"));
        assertTrue(graph.successors("GHOST-PARA").isEmpty());
        assertEquals(List.of("MAIN-PARA"), graph.predecessors("GHOST-PARA"));
        assertEquals(List.of("GHOST-PARA"), graph.danglingTargets);
    }

    @Test
    void commentLines_contributeNoTextNoBoundariesAndNoCalls() {
        String source = String.join("\n",
                "000100 IDENTIFICATION DIVISION.",
                "000200 PROGRAM-ID. CMT.",
                "000300*PROCEDURE DIVISION.",
                "000400 PROCEDURE DIVISION.",
                "000500 MAIN-PARA.",
                "000600*    PERFORM HIDDEN-PARA.",
                "000700     PERFORM SHOWN-PARA.",
                "000800     STOP RUN.");

        COBOLProgram program = parser.parse("cmt.cbl", source);

        assertFalse(program.content.contains("HIDDEN-PARA"));
        assertEquals(List.of("IDENTIFICATION", "PROCEDURE"), divisionNames(program));
        List<COBOLParagraph> paragraphs = paragraphs(procedure(program));
        assertEquals(1, paragraphs.size());
        assertEquals("MAIN-PARA", paragraphs.get(0).name);
        assertEquals(List.of("SHOWN-PARA"), paragraphs.get(0).calls);
    }

    @Test
    void numberedSourceWithDirectiveAndTabLines_isStillColumnStripped() {
        String source = String.join("\n",
                "      $SET ANS85",
                "000100 IDENTIFICATION DIVISION.",
                "000200 PROGRAM-ID. CMT.",
                "000300*PROCEDURE DIVISION.",
                "000400 PROCEDURE DIVISION.",
                "000500 MAIN-PARA.",
                "000600*    PERFORM HIDDEN-PARA.",
                "\tPERFORM SHOWN-PARA.",
                "000800     STOP RUN.");

        COBOLProgram program = parser.parse("cmt.cbl", source);

        assertEquals("CMT", program.programName);
        assertEquals(List.of("IDENTIFICATION", "PROCEDURE"), divisionNames(program));
        assertFalse(program.content.contains("HIDDEN-PARA"));
        assertFalse(program.content.contains("$SET"));
        assertEquals(List.of("SHOWN-PARA"), paragraphs(procedure(program)).get(0).calls);
    }

    @Test
    void sectionsInProcedureDivision_ownTheirParagraphs() {
        String source = String.join("\n",
                "PROCEDURE DIVISION.",
                "MAIN-LOGIC SECTION.",
                "    PERFORM INIT.",
                "INIT.",
                "    PERFORM LOAD-DATA",
                "    PERFORM LOAD-DATA.",
                "WORK SECTION.",
                "LOAD-DATA.",
                "    DISPLAY 'L'.");

        COBOLDivision procedure = procedure(parser.parse("sections.cbl", source));

        assertEquals(List.of("MAIN-LOGIC", "WORK"),
                procedure.sections.stream().map(s -> s.name).collect(Collectors.toList()));
        COBOLSection main = procedure.sections.get(0);
        assertEquals(List.of("MAIN-LOGIC-HEADER", "INIT"),
                main.paragraphs.stream().map(p -> p.name).collect(Collectors.toList()));
        assertEquals(List.of("INIT"), main.paragraphs.get(0).calls);
        assertEquals(List.of("LOAD-DATA", "LOAD-DATA"), main.paragraphs.get(1).calls);

        CallGraph graph = procedure.callGraph;
        assertEquals(List.of("MAIN-LOGIC-HEADER", "INIT", "LOAD-DATA"), graph.nodes);
        assertEquals(List.of(
                new CallEdge("MAIN-LOGIC-HEADER", "INIT"),
                new CallEdge("INIT", "LOAD-DATA"),
                new CallEdge("INIT", "LOAD-DATA")), graph.edges);
        assertTrue(graph.danglingTargets.isEmpty());
    }

    @Test
    void dataDivisionSections_haveNoParagraphs() {
        String source = String.join("\n",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01 WS-A PIC X.",
                "LINKAGE SECTION.",
                "01 LS-B PIC 9.");

        COBOLDivision data = parser.parse("data.cbl", source).divisions.get(0);

        assertEquals(List.of("WORKING-STORAGE", "LINKAGE"),
                data.sections.stream().map(s -> s.name).collect(Collectors.toList()));
        assertEquals("01 WS-A PIC X.", data.sections.get(0).code);
        assertTrue(data.sections.stream().allMatch(s -> s.paragraphs.isEmpty()));
        assertNull(data.callGraph);
    }

    @Test
    void textWithoutDivisions_degradesToOneDefaultDivision() {
        COBOLProgram program = parser.parse("loose.cbl", "DISPLAY 'HELLO'.\nSTOP RUN.");

        assertEquals(COBOLProgram.UNKNOWN_PROGRAM, program.programName);
        assertEquals(List.of("DEFAULT"), divisionNames(program));
        COBOLDivision division = program.divisions.get(0);
        assertEquals(List.of("DEFAULT"), division.sections.stream().map(s -> s.name).collect(Collectors.toList()));
        assertTrue(division.sections.get(0).paragraphs.isEmpty());
        assertNull(division.callGraph);
    }

    @Test
    void emptyText_stillParses() {
        COBOLProgram program = parser.parse("empty.cbl", "");

        assertEquals("", program.content);
        assertEquals(List.of("DEFAULT"), divisionNames(program));
    }

    @Test
    void quotedProgramId_isUnquotedAndUppercased() {
        assertEquals("PAY-01", CobolProgramParser.extractProgramName("PROGRAM-ID. 'pay-01'."));
        assertEquals("MAIN", CobolProgramParser.extractProgramName("PROGRAM-ID.    MAIN IS INITIAL."));
        assertEquals(COBOLProgram.UNKNOWN_PROGRAM, CobolProgramParser.extractProgramName("AUTHOR. NOBODY."));
    }

    @Test
    void goToTargets_whenConfigured() {
        CobolProgramParser withGoTo = new CobolProgramParser(SourceFormat.FREE,
                new CallExtractor(EnumSet.of(TransferKeyword.PERFORM, TransferKeyword.GO_TO)));
        String source = "PROCEDURE DIVISION.\nMAIN-PARA.\n    PERFORM WORK-PARA\n    GO TO END-PARA.\nEND-PARA.\n    STOP RUN.";

        CallGraph graph = procedure(withGoTo.parse("goto.cbl", source)).callGraph;

        assertEquals(List.of("WORK-PARA", "END-PARA"), graph.successors("MAIN-PARA"));
        assertEquals(List.of("WORK-PARA"), graph.danglingTargets);
    }

    @Test
    void everyCallTargetAndParagraph_isAGraphNode() {
        String source = String.join("\n",
                "PROCEDURE DIVISION.",
                "A-SEC SECTION.",
                "    PERFORM P1.",
                "P1.",
                "    PERFORM P2 PERFORM P9.",
                "B-SEC SECTION.",
                "P2.",
                "    PERFORM P1.",
                "P2.",
                "    PERFORM P8.");

        COBOLDivision procedure = procedure(parser.parse("prop.cbl", source));

        for (COBOLParagraph paragraph : paragraphs(procedure)) {
            assertTrue(procedure.callGraph.nodes.contains(paragraph.name), paragraph.name);
            assertTrue(procedure.callGraph.nodes.containsAll(paragraph.calls), paragraph.name);
        }
        assertEquals(List.of("P9", "P8"), procedure.callGraph.danglingTargets);
    }

    @Test
    void nullArguments_areRejected() {
        assertThrows(NullPointerException.class, () -> parser.parse(null, "x"));
        assertThrows(NullPointerException.class, () -> parser.parse("x.cbl", null));
    }
}
