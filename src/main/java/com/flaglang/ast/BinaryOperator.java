package com.flaglang.ast;

/**
 * Binary operators, grouped by precedence level.
 */
public enum BinaryOperator {
    // Logical
    OR("or"),
    AND("and"),

    // Equality
    EQUALS("=="),
    ASSIGN("="),
    NOT_EQUALS("!="),

    // Comparison
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_EQUAL(">="),
    LESS_EQUAL("<="),
    IN("in");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
