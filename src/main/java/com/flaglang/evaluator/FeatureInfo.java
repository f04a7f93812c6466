package com.flaglang.evaluator;

/**
 * Name and body kind of a declared feature flag.
 */
public record FeatureInfo(String name, FeatureKind kind) {
}
