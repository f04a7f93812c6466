package com.flaglang.evaluator;

import com.flaglang.ast.FeatureFlag;
import com.flaglang.ast.Program;
import com.flaglang.ast.SimpleFeatureFlagBody;
import com.flaglang.exception.FlagLangException;
import com.flaglang.exception.FlagNotFoundException;
import com.flaglang.interpreter.EvaluationContext;
import com.flaglang.interpreter.EvaluationResult;
import com.flaglang.interpreter.Interpreter;
import com.flaglang.lang.FlagLanguage;
import com.flaglang.value.Value;
import com.flaglang.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * FlagEvaluator backed by the scanner, parser and {@link Interpreter}.
 * Parsed programs are cached per source text when enabled; cached programs are
 * immutable, so the evaluator is safe to share between threads.
 */
public class DefaultFlagEvaluator implements FlagEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultFlagEvaluator.class);

    private final EvaluatorOptions options;
    private final Interpreter interpreter;
    private final Map<String, Program> programCache = new ConcurrentHashMap<>();

    public DefaultFlagEvaluator() {
        this(EvaluatorOptions.defaults());
    }

    public DefaultFlagEvaluator(EvaluatorOptions options) {
        this(options, new Interpreter());
    }

    public DefaultFlagEvaluator(EvaluatorOptions options, Interpreter interpreter) {
        this.options = options;
        this.interpreter = interpreter;
    }

    public EvaluatorOptions getOptions() {
        return options;
    }

    @Override
    public List<EvaluationResult> evaluate(String source, EvaluationContext context) {
        try {
            return interpreter.interpretProgram(parseSource(source), context);
        } catch (FlagLangException e) {
            if (options.throwOnError()) {
                throw e;
            }
            log.warn("Failed to evaluate feature flags, returning no results: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public Value evaluateFeature(String source, String featureName, EvaluationContext context) {
        try {
            Program program = parseSource(source);
            FeatureFlag feature = program.findFeature(featureName)
                    .orElseThrow(() -> new FlagNotFoundException(featureName));
            return interpreter.interpretFeatureFlag(feature, context).value();
        } catch (FlagLangException e) {
            return fallback(featureName, e);
        }
    }

    @Override
    public boolean isEnabled(String source, String featureName, EvaluationContext context) {
        return Values.isTruthy(evaluateFeature(source, featureName, context));
    }

    @Override
    public Map<String, Value> evaluateFeatures(String source, List<String> featureNames,
                                               EvaluationContext context) {
        Map<String, Value> results = new LinkedHashMap<>();

        Program program;
        try {
            program = parseSource(source);
        } catch (FlagLangException e) {
            for (String name : featureNames) {
                results.put(name, fallback(name, e));
            }
            return results;
        }

        for (String name : featureNames) {
            try {
                FeatureFlag feature = program.findFeature(name)
                        .orElseThrow(() -> new FlagNotFoundException(name));
                results.put(name, interpreter.interpretFeatureFlag(feature, context).value());
            } catch (FlagLangException e) {
                results.put(name, fallback(name, e));
            }
        }
        return results;
    }

    @Override
    public List<FeatureInfo> getFeatureInfo(String source) {
        try {
            List<FeatureInfo> infos = new ArrayList<>();
            for (FeatureFlag feature : parseSource(source).features()) {
                FeatureKind kind = feature.body() instanceof SimpleFeatureFlagBody
                        ? FeatureKind.SIMPLE
                        : FeatureKind.COMPLEX;
                infos.add(new FeatureInfo(feature.name(), kind));
            }
            return infos;
        } catch (FlagLangException e) {
            if (options.throwOnError()) {
                throw e;
            }
            log.warn("Failed to read feature flag info: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public ValidationResult validate(String source) {
        try {
            FlagLanguage.parse(source);
            return ValidationResult.ok();
        } catch (FlagLangException e) {
            return ValidationResult.failed(e.getMessage());
        }
    }

    @Override
    public void clearCache() {
        programCache.clear();
        log.debug("Cleared program cache");
    }

    private Program parseSource(String source) {
        if (!options.cache()) {
            return FlagLanguage.parse(source);
        }

        Program cached = programCache.get(source);
        if (cached != null) {
            log.debug("Program cache hit ({} cached)", programCache.size());
            return cached;
        }

        log.debug("Program cache miss, parsing {} characters", source.length());
        Program program = FlagLanguage.parse(source);
        programCache.putIfAbsent(source, program);
        return program;
    }

    private Value fallback(String featureName, FlagLangException e) {
        if (options.throwOnError()) {
            throw e;
        }
        log.warn("Feature flag '{}' fell back to default value {}: {}",
                featureName, options.defaultValue(), e.getMessage());
        return options.defaultValue();
    }
}
