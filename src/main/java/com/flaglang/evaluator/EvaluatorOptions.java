package com.flaglang.evaluator;

import com.flaglang.value.Value;

import java.util.Objects;

/**
 * Evaluator settings.
 *
 * @param cache        Memoise parsed programs per source text
 * @param throwOnError Propagate errors instead of returning {@code defaultValue}
 * @param defaultValue Value returned for missing or failing flags when errors are not thrown
 */
public record EvaluatorOptions(boolean cache, boolean throwOnError, Value defaultValue) {

    public EvaluatorOptions {
        Objects.requireNonNull(defaultValue, "defaultValue");
    }

    /**
     * Cache on, errors suppressed, default value false.
     */
    public static EvaluatorOptions defaults() {
        return new EvaluatorOptions(true, false, Value.BooleanValue.FALSE);
    }

    public EvaluatorOptions withCache(boolean cache) {
        return new EvaluatorOptions(cache, throwOnError, defaultValue);
    }

    public EvaluatorOptions withThrowOnError(boolean throwOnError) {
        return new EvaluatorOptions(cache, throwOnError, defaultValue);
    }

    public EvaluatorOptions withDefaultValue(Object defaultValue) {
        return new EvaluatorOptions(cache, throwOnError, Value.of(defaultValue));
    }
}
