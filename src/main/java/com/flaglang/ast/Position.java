package com.flaglang.ast;

/**
 * Location of a node or error in the source text.
 *
 * @param line   1-based line number
 * @param column 1-based column number
 * @param offset 0-based character offset
 */
public record Position(int line, int column, int offset) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
