package com.flaglang.lang;

import java.util.List;

/**
 * Decides whether a parenthesis opens a list literal or a grouped expression.
 * <p>
 * Scans the balanced span after the '(' without consuming tokens. The span is a list
 * when a comma and no operator appear at its top nesting level: {@code (ms, mx, m3)}
 * is a list, {@code (a == b)} and {@code (a == b, c)} are groups.
 */
final class ListLiteralClassifier {

    private ListLiteralClassifier() {
    }

    /**
     * @param tokens Significant tokens
     * @param from   Index of the first token after the opening parenthesis
     * @return true if the span should be parsed as a list literal
     */
    static boolean isListLiteral(List<Token> tokens, int from) {
        int depth = 1;
        boolean hasComma = false;
        boolean hasOperator = false;

        for (int i = from; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.EOF) {
                break;
            }
            if (type == TokenType.LEFT_PAREN) {
                depth++;
            } else if (type == TokenType.RIGHT_PAREN) {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (depth == 1) {
                if (type == TokenType.COMMA) {
                    hasComma = true;
                } else if (type.isOperator()) {
                    hasOperator = true;
                }
            }
        }

        return hasComma && !hasOperator;
    }
}
