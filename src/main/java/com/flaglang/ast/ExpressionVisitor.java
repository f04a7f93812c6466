package com.flaglang.ast;

/**
 * Visitor over every expression variant.
 *
 * @param <R> Result type
 */
public interface ExpressionVisitor<R> {

    R visitBoolean(Expression.BooleanLiteral expression);

    R visitNumber(Expression.NumberLiteral expression);

    R visitString(Expression.StringLiteral expression);

    R visitDate(Expression.DateLiteral expression);

    R visitIdentifier(Expression.Identifier expression);

    R visitJson(Expression.JsonLiteral expression);

    R visitNow(Expression.NowCall expression);

    R visitBinary(Expression.BinaryExpression expression);

    R visitUnary(Expression.UnaryExpression expression);

    R visitList(Expression.ListExpression expression);

    R visitGroup(Expression.GroupExpression expression);
}
