package org.dxworks.cobolframe.analyzer.cobol;

public enum SegmentKind {
    /** Introduced by a boundary match; named after the captured identifier. */
    NAMED,
    /** Text preceding the first boundary match. */
    HEADER,
    /** The whole text, when no boundary matched at all. */
    DEFAULT;

    public boolean isSentinel() {
        return this != NAMED;
    }
}
