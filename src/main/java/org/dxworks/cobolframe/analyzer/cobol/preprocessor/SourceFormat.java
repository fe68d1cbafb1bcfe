package org.dxworks.cobolframe.analyzer.cobol.preprocessor;

/**
 * Reference format of a COBOL source file.
 */
public enum SourceFormat {
    /** Columns 1-6 sequence area, column 7 indicator, 73-80 identification area. */
    FIXED,
    /** No column conventions; full-line comments start with {@code *>}. */
    FREE,
    /** Decide per file from the column 7 indicators. */
    AUTO
}
