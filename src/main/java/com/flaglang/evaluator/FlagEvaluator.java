package com.flaglang.evaluator;

import com.flaglang.interpreter.EvaluationContext;
import com.flaglang.interpreter.EvaluationResult;
import com.flaglang.value.Value;

import java.util.List;
import java.util.Map;

/**
 * Evaluates feature flags straight from source text.
 * Combines scanning, parsing and interpretation, and decides per {@link EvaluatorOptions}
 * whether failures are thrown or replaced by the default value.
 */
public interface FlagEvaluator {

    /**
     * Evaluate every flag in the source.
     *
     * @return Results in declaration order, or an empty list on failure when errors are suppressed
     */
    List<EvaluationResult> evaluate(String source, EvaluationContext context);

    /**
     * Evaluate one flag by name. The last declaration with that name wins.
     *
     * @throws com.flaglang.exception.FlagNotFoundException if the flag is missing and errors are thrown
     */
    Value evaluateFeature(String source, String featureName, EvaluationContext context);

    /**
     * Truthiness of {@link #evaluateFeature}.
     */
    boolean isEnabled(String source, String featureName, EvaluationContext context);

    /**
     * Evaluate several flags. Missing or failing flags map to the default value
     * when errors are suppressed.
     *
     * @return Values keyed by flag name, in the requested order
     */
    Map<String, Value> evaluateFeatures(String source, List<String> featureNames, EvaluationContext context);

    /**
     * List the declared flags.
     */
    List<FeatureInfo> getFeatureInfo(String source);

    /**
     * Scan and parse without evaluating.
     */
    ValidationResult validate(String source);

    /**
     * Drop all memoised programs.
     */
    void clearCache();
}
