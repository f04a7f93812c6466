package com.flaglang.evaluator;

/**
 * Shape of a feature flag body.
 */
public enum FeatureKind {
    /** {@code FF-name -> value} */
    SIMPLE,
    /** {@code FF-name { rules... default }} */
    COMPLEX
}
