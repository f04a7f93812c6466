package com.flaglang.ast;

import com.flaglang.value.Value;

import java.util.List;

/**
 * Expression tree node. Every variant owns its children; trees never share nodes.
 */
public sealed interface Expression {

    Position position();

    <R> R accept(ExpressionVisitor<R> visitor);

    record BooleanLiteral(boolean value, Position position) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    record NumberLiteral(double value, Position position) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record StringLiteral(String value, Position position) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    /**
     * Date in YYYY-MM-DD form. Calendar validity is checked at evaluation.
     */
    record DateLiteral(String value, Position position) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitDate(this);
        }
    }

    record Identifier(String name, Position position) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /**
     * Object built at parse time from {@code json({...})}.
     */
    record JsonLiteral(Value.ObjectValue value, Position position) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitJson(this);
        }
    }

    record NowCall(Position position) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNow(this);
        }
    }

    record BinaryExpression(Expression left, BinaryOperator operator, Expression right, Position position)
            implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record UnaryExpression(UnaryOperator operator, Expression operand, Position position) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * Parenthesized, comma-separated list: {@code (a, b, c)}.
     */
    record ListExpression(List<Expression> elements, Position position) implements Expression {
        public ListExpression {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    record GroupExpression(Expression inner, Position position) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitGroup(this);
        }
    }
}
