package org.dxworks.cobolframe.analyzer.cobol;

/**
 * One slice of a text block produced by {@link SegmentSplitter}.
 */
public final class Segment {
    public static final String HEADER_NAME = "HEADER";
    public static final String DEFAULT_NAME = "DEFAULT";

    public final SegmentKind kind;
    public final String name;
    public final String boundary; // matched boundary text, empty for sentinels
    public final String code;

    Segment(SegmentKind kind, String name, String boundary, String code) {
        this.kind = kind;
        this.name = name;
        this.boundary = boundary;
        this.code = code;
    }

    static Segment header(String code) {
        return new Segment(SegmentKind.HEADER, HEADER_NAME, "", code);
    }

    static Segment whole(String code) {
        return new Segment(SegmentKind.DEFAULT, DEFAULT_NAME, "", code);
    }

    static Segment named(String name, String boundary, String code) {
        return new Segment(SegmentKind.NAMED, name, boundary, code);
    }

    @Override
    public String toString() {
        return kind + ":" + name;
    }
}
