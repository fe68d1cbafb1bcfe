package org.dxworks.cobolframe.analyzer.cobol;

import java.util.regex.Pattern;

/**
 * Boundary patterns for the structural levels of a COBOL program.
 * Every pattern captures the boundary identifier in group 1.
 * <p>
 * {@link #PARAGRAPH} is stricter than "a word followed by a period at line start": the statements
 * {@code EXIT.}, {@code GOBACK.}, {@code CONTINUE.} and the {@code END-xxx.} scope terminators
 * standing alone on a line are body text, not paragraph headers.
 */
final class CobolPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    static final String IDENTIFIER = "[A-Z0-9][A-Z0-9-]*";

    // PROCEDURE DIVISION USING/CHAINING/RETURNING clauses are consumed up to the closing period
    static final Pattern DIVISION = Pattern.compile(
        "^[ \\t]*(IDENTIFICATION|ID|ENVIRONMENT|DATA|PROCEDURE)[ \\t]+DIVISION" +
        "(?:[ \\t]+(?:USING|CHAINING|RETURNING)\\b[^.]*)?[ \\t]*\\.",
        FLAGS
    );

    static final Pattern SECTION = Pattern.compile(
        "^[ \\t]*([A-Z0-9-]+)[ \\t]+SECTION(?:[ \\t]+[0-9]+)?[ \\t]*\\.",
        FLAGS
    );

    // Single-word statements ending in a period look like paragraph headers
    private static final String STATEMENT_WORDS =
        "EXIT|GOBACK|CONTINUE|END-IF|END-PERFORM|END-EVALUATE|END-READ|END-WRITE|END-REWRITE" +
        "|END-DELETE|END-START|END-RETURN|END-CALL|END-EXEC|END-SEARCH|END-STRING|END-UNSTRING" +
        "|END-COMPUTE|END-ADD|END-SUBTRACT|END-MULTIPLY|END-DIVIDE|END-ACCEPT|END-DISPLAY";

    static final Pattern PARAGRAPH = Pattern.compile(
        "^[ \\t]*(?!(?:" + STATEMENT_WORDS + ")[ \\t]*\\.)(" + IDENTIFIER + ")[ \\t]*\\.(?![ \\t]*\\.)",
        FLAGS
    );

    static final Pattern PROGRAM_ID = Pattern.compile(
        "^[ \\t]*PROGRAM-ID[ \\t]*\\.[ \\t]*['\"]?(" + IDENTIFIER + ")['\"]?(?=[ \\t.]|$)",
        FLAGS
    );

    private CobolPatterns() {}
}
