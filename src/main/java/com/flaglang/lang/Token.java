package com.flaglang.lang;

import com.flaglang.ast.Position;

/**
 * Represents a token in feature flag source.
 *
 * @param type   Token type
 * @param text   Token value (string literals are unescaped, without quotes)
 * @param lexeme Exact source slice covered by the token
 * @param line   1-based line of the first character
 * @param column 1-based column of the first character
 * @param start  Offset of the first character in the source
 * @param end    Offset one past the last character
 */
public record Token(TokenType type, String text, String lexeme, int line, int column, int start, int end) {

    public Position position() {
        return new Position(line, column, start);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
