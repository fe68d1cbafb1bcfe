package org.dxworks.cobolframe.analyzer.cobol;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Partitions a text block at the matches of a boundary pattern.
 * Group 1 of the pattern captures the identifier that names the segment.
 * Matches are taken leftmost first, non-overlapping, in text order.
 */
public final class SegmentSplitter {

    private SegmentSplitter() {}

    public static List<Segment> split(String text, Pattern boundary) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(boundary, "boundary");

        List<BoundaryMatch> matches = findBoundaries(text, boundary);
        List<Segment> segments = new ArrayList<>(matches.size() + 1);

        if (matches.isEmpty()) {
            segments.add(Segment.whole(text));
            return segments;
        }

        if (matches.get(0).start > 0) {
            segments.add(Segment.header(text.substring(0, matches.get(0).start)));
        }

        for (int i = 0; i < matches.size(); i++) {
            BoundaryMatch match = matches.get(i);
            int end = i + 1 < matches.size() ? matches.get(i + 1).start : text.length();
            String code = text.substring(match.end, end).strip();
            segments.add(Segment.named(match.name, text.substring(match.start, match.end), code));
        }
        return segments;
    }

    private static List<BoundaryMatch> findBoundaries(String text, Pattern boundary) {
        List<BoundaryMatch> spans = new ArrayList<>();
        Matcher matcher = boundary.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1).strip().toUpperCase(Locale.ROOT);
            spans.add(new BoundaryMatch(matcher.start(), matcher.end(), name));
        }
        return spans;
    }

    private static class BoundaryMatch {
        final int start;
        final int end;
        final String name;

        BoundaryMatch(int start, int end, String name) {
            this.start = start;
            this.end = end;
            this.name = name;
        }
    }
}
