package com.flaglang.ast;

/**
 * Unconditional flag body: {@code FF-name -> value}.
 */
public record SimpleFeatureFlagBody(Expression value, Position position) implements FeatureFlagBody {
}
