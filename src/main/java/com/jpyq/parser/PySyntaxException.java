package com.jpyq.parser;

/**
 * Source text is not valid Python. Line and column are 1-based.
 */
public class PySyntaxException extends IllegalArgumentException {
    private final String reason;
    private final int line;
    private final int column;

    public PySyntaxException(String reason, int line, int column) {
        super(reason + " at line " + line + ", column " + column);
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
