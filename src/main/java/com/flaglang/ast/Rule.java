package com.flaglang.ast;

/**
 * A condition/value pair inside a complex body.
 */
public record Rule(Expression condition, Expression value, Position position) {
}
