package org.dxworks.cobolframe.analyzer.cobol.preprocessor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Canonicalizes line endings and strips the fixed-format column areas
 * (sequence numbers, indicator-marked comment, debug and directive lines, identification area).
 */
public final class CobolLineNormalizer {

    private static final int INDICATOR_COLUMN = 6;
    private static final int PROGRAM_AREA_END = 72;
    private static final int FULL_CARD_LENGTH = 80;
    private static final int TAB_WIDTH = 8;
    private static final String FREE_COMMENT = "*>";

    private CobolLineNormalizer() {}

    public static String normalize(String source, SourceFormat format) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(format, "format");

        String[] lines = canonicalizeLineEndings(source).split("\n", -1);
        SourceFormat effective = format == SourceFormat.AUTO ? detectFormat(lines) : format;

        List<String> kept = new ArrayList<>(lines.length);
        for (String line : lines) {
            String processed = effective == SourceFormat.FIXED ? processFixedLine(line) : processFreeLine(line);
            if (processed != null) {
                kept.add(processed);
            }
        }
        return String.join("\n", kept).strip();
    }

    public static String canonicalizeLineEndings(String source) {
        return source.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Decides between FIXED and FREE by a vote over the lines long enough to reach the indicator column.
     * <p>
     * A line votes FIXED when its sequence area holds only digits and blanks and column 7 carries an
     * indicator, and FREE otherwise. Lines with a blank sequence area and a blank indicator fit both
     * layouts and do not vote, so a numbered source with a few irregular lines stays FIXED.
     */
    static SourceFormat detectFormat(String[] lines) {
        int fixedVotes = 0;
        int freeVotes = 0;
        boolean sawIndicatorColumn = false;
        for (String raw : lines) {
            if (raw.isBlank()) continue;
            String line = expandTabs(raw);
            if (line.length() <= INDICATOR_COLUMN) continue;
            sawIndicatorColumn = true;

            String sequenceArea = line.substring(0, INDICATOR_COLUMN);
            char indicator = line.charAt(INDICATOR_COLUMN);
            if (!isSequenceArea(sequenceArea) || !isIndicator(indicator)) {
                freeVotes++;
            } else if (!sequenceArea.isBlank() || indicator != ' ') {
                fixedVotes++;
            }
        }
        return sawIndicatorColumn && fixedVotes >= freeVotes ? SourceFormat.FIXED : SourceFormat.FREE;
    }

    // null means the line is dropped
    static String processFixedLine(String raw) {
        String line = expandTabs(raw);
        if (line.length() > INDICATOR_COLUMN && isDroppedIndicator(line.charAt(INDICATOR_COLUMN))) {
            return null;
        }
        if (line.length() >= FULL_CARD_LENGTH) {
            return line.substring(INDICATOR_COLUMN, PROGRAM_AREA_END).stripTrailing();
        }
        if (line.length() > INDICATOR_COLUMN) {
            return line.substring(INDICATOR_COLUMN).stripTrailing();
        }
        return line.stripTrailing();
    }

    // Tab stops every 8 columns, the card layout most compilers assume
    static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder sb = new StringBuilder(line.length() + TAB_WIDTH);
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                do {
                    sb.append(' ');
                } while (sb.length() % TAB_WIDTH != 0);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String processFreeLine(String line) {
        if (line.stripLeading().startsWith(FREE_COMMENT)) {
            return null;
        }
        return line.stripTrailing();
    }

    // comment, page eject, debug line, compiler directive
    private static boolean isDroppedIndicator(char c) {
        return c == '*' || c == '/' || c == 'D' || c == 'd' || c == '$';
    }

    private static boolean isIndicator(char c) {
        return c == ' ' || c == '-' || isDroppedIndicator(c);
    }

    private static boolean isSequenceArea(String area) {
        for (int i = 0; i < area.length(); i++) {
            char c = area.charAt(i);
            if (c != ' ' && (c < '0' || c > '9')) {
                return false;
            }
        }
        return true;
    }
}
