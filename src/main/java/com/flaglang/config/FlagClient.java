package com.flaglang.config;

import com.flaglang.evaluator.DefaultFlagEvaluator;
import com.flaglang.evaluator.FeatureInfo;
import com.flaglang.evaluator.FlagEvaluator;
import com.flaglang.evaluator.ValidationResult;
import com.flaglang.interpreter.EvaluationContext;
import com.flaglang.interpreter.EvaluationResult;
import com.flaglang.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Evaluates the flags of one configuration.
 * Sources are read once, joined with newlines and evaluated as a single program,
 * so a later source can redefine a flag from an earlier one.
 */
public class FlagClient {

    private static final Logger log = LoggerFactory.getLogger(FlagClient.class);

    private final String name;
    private final String source;
    private final FlagEvaluator evaluator;

    public FlagClient(String name, String source, FlagEvaluator evaluator) {
        this.name = name;
        this.source = source;
        this.evaluator = evaluator;
    }

    /**
     * Read the configured sources and bind them to a new evaluator.
     */
    public static FlagClient from(FlagsConfig config) {
        return from(config, new DefaultFlagEvaluator(config.evaluator()));
    }

    public static FlagClient from(FlagsConfig config, FlagEvaluator evaluator) {
        StringBuilder source = new StringBuilder();
        for (String path : config.sources()) {
            source.append(ConfigLoader.loadSource(path)).append('\n');
        }

        FlagClient client = new FlagClient(config.name(), source.toString(), evaluator);
        log.info("FlagClient '{}' initialized from {} sources", config.name(), config.sources().size());
        return client;
    }

    public List<EvaluationResult> evaluateAll(EvaluationContext context) {
        return evaluator.evaluate(source, context);
    }

    public Value evaluate(String featureName, EvaluationContext context) {
        return evaluator.evaluateFeature(source, featureName, context);
    }

    public boolean isEnabled(String featureName, EvaluationContext context) {
        return evaluator.isEnabled(source, featureName, context);
    }

    /**
     * Scan and parse the bound sources without evaluating them.
     */
    public ValidationResult validate() {
        return evaluator.validate(source);
    }

    public List<FeatureInfo> featureInfo() {
        return evaluator.getFeatureInfo(source);
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }
}
