package org.fungrim.lite.source;

/**
 * Exception thrown when source-syntax text cannot be parsed.
 * Carries the 1-based line and 0-based column when the parser reported them.
 */
public class SourceParseException extends RuntimeException {

    private final int line;
    private final int column;

    public SourceParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public SourceParseException(String message, int line, int column) {
        super("line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
