package com.flaglang.ast;

/**
 * Body of a feature flag: a single value or a list of rules with a default.
 */
public sealed interface FeatureFlagBody permits SimpleFeatureFlagBody, ComplexFeatureFlagBody {

    Position position();
}
