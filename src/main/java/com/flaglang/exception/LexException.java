package com.flaglang.exception;

/**
 * Exception thrown when source text cannot be tokenized.
 * Scanning is all-or-nothing: no partial token list is ever returned.
 */
public class LexException extends FlagLangException {

    private final int line;
    private final int column;

    public LexException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
