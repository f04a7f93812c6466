package com.flaglang.interpreter;

import com.flaglang.value.Value;

/**
 * Result of evaluating one feature flag.
 *
 * @param name    Flag name
 * @param value   Resulting value
 * @param matched true for a simple flag or a matching rule; false when the default
 *                (or the implicit false) was used
 */
public record EvaluationResult(String name, Value value, boolean matched) {

    public static EvaluationResult matched(String name, Value value) {
        return new EvaluationResult(name, value, true);
    }

    public static EvaluationResult unmatched(String name, Value value) {
        return new EvaluationResult(name, value, false);
    }
}
