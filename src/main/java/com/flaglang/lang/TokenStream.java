package com.flaglang.lang;

import com.flaglang.exception.ParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Cursor over the significant tokens of a source.
 * Comments and newlines are dropped on construction.
 */
final class TokenStream {

    private final List<Token> tokens;
    private int index;

    TokenStream(List<Token> source) {
        List<Token> significant = new ArrayList<>(source.size());
        for (Token token : source) {
            if (!token.type().isTrivia()) {
                significant.add(token);
            }
        }
        if (significant.isEmpty() || significant.get(significant.size() - 1).type() != TokenType.EOF) {
            significant.add(endOfInput(significant));
        }
        this.tokens = List.copyOf(significant);
        this.index = 0;
    }

    List<Token> tokens() {
        return tokens;
    }

    int index() {
        return index;
    }

    boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    boolean check(TokenType type) {
        return peek().type() == type;
    }

    Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    Token peek() {
        return tokens.get(index);
    }

    Token previous() {
        return tokens.get(index - 1);
    }

    ParseException error(String message) {
        return new ParseException(message, peek().position());
    }

    private static Token endOfInput(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return new Token(TokenType.EOF, "", "", 1, 1, 0, 0);
        }
        Token last = tokens.get(tokens.size() - 1);
        return new Token(TokenType.EOF, "", "", last.line(), last.column() + last.lexeme().length(),
                last.end(), last.end());
    }
}
