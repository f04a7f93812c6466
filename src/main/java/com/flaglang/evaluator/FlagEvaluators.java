package com.flaglang.evaluator;

import com.flaglang.interpreter.EvaluationContext;
import com.flaglang.value.Value;

/**
 * Static shortcuts for one-off evaluations.
 */
public final class FlagEvaluators {

    private FlagEvaluators() {
    }

    public static FlagEvaluator create(EvaluatorOptions options) {
        return new DefaultFlagEvaluator(options);
    }

    public static Value evaluateFeatureFlag(String source, String featureName, EvaluationContext context) {
        return evaluateFeatureFlag(source, featureName, context, EvaluatorOptions.defaults());
    }

    public static Value evaluateFeatureFlag(String source, String featureName, EvaluationContext context,
                                            EvaluatorOptions options) {
        return create(options).evaluateFeature(source, featureName, context);
    }

    public static boolean isFeatureEnabled(String source, String featureName, EvaluationContext context) {
        return isFeatureEnabled(source, featureName, context, EvaluatorOptions.defaults());
    }

    public static boolean isFeatureEnabled(String source, String featureName, EvaluationContext context,
                                           EvaluatorOptions options) {
        return create(options).isEnabled(source, featureName, context);
    }
}
