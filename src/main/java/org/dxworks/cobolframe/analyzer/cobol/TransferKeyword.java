package org.dxworks.cobolframe.analyzer.cobol;

/**
 * Statement forms that name another paragraph or section as an execution target.
 * Each pattern includes the whitespace that separates the keyword from the target.
 */
public enum TransferKeyword {
    // target on the same line; a bare PERFORM opens an inline block
    PERFORM("PERFORM[ \\t]+"),
    // TO is taken possessively so that "GO TO" never reads TO as the target
    GO_TO("GO(?:\\s+TO\\b)?+\\s+");

    private final String regex;

    TransferKeyword(String regex) {
        this.regex = regex;
    }

    String regex() {
        return regex;
    }
}
