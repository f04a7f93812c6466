package com.flaglang.config;

import com.flaglang.evaluator.EvaluatorOptions;

import java.util.List;

/**
 * Root configuration for a set of feature flag sources.
 *
 * @param name      Configuration name, used in logs
 * @param sources   Flag source locations (classpath: or filesystem), concatenated in order
 * @param evaluator Evaluator options
 */
public record FlagsConfig(String name, List<String> sources, EvaluatorOptions evaluator) {

    public FlagsConfig {
        sources = List.copyOf(sources);
    }
}
