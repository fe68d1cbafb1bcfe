package org.dxworks.cobolframe;

/**
 * Raised by callers of the parser when a source file has nothing to parse.
 */
public class InvalidSourceException extends RuntimeException {
    public InvalidSourceException(String message) {
        super(message);
    }
}
