package com.flaglang.lang;

/**
 * Token types for the feature flag language.
 */
public enum TokenType {
    // Identifiers and literals
    FEATURE_FLAG_NAME,
    IDENTIFIER,
    STRING,
    NUMBER,
    DATE,
    BOOLEAN_TRUE,
    BOOLEAN_FALSE,

    // Comparison operators
    ARROW,
    EQUALS,
    NOT_EQUALS,
    ASSIGN,
    GREATER_THAN,
    LESS_THAN,
    GREATER_EQUAL,
    LESS_EQUAL,

    // Logical operators
    AND,
    OR,
    NOT,
    IN,

    // Delimiters
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    COMMA,
    COLON,

    // Functions
    JSON_FUNC,
    NOW_FUNC,

    // Trivia
    COMMENT,
    NEWLINE,

    // Special
    EOF;

    /**
     * Whether the parser ignores this token type.
     */
    public boolean isTrivia() {
        return this == COMMENT || this == NEWLINE;
    }

    /**
     * Whether this token type is a binary or unary operator.
     * Used by the list-literal lookahead.
     */
    public boolean isOperator() {
        return switch (this) {
            case AND, OR, NOT, EQUALS, NOT_EQUALS, ASSIGN,
                    GREATER_THAN, LESS_THAN, GREATER_EQUAL, LESS_EQUAL, IN -> true;
            default -> false;
        };
    }
}
