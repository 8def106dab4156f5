package com.libragraph.attest.formats.api;

/**
 * Content could not be parsed for its declared kind.
 *
 * <p>Recoverable: the fingerprinter answers it by hashing raw bytes instead.
 */
public class SourceParseException extends Exception {

    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
        this.column = -1;
    }

    /** 1-based line of the failure, or -1 if unknown. */
    public int line() {
        return line;
    }

    /** 0-based column of the failure, or -1 if unknown. */
    public int column() {
        return column;
    }
}
