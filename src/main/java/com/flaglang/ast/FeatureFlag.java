package com.flaglang.ast;

/**
 * A named feature flag declaration.
 *
 * @param name     Flag name, including its "FF-" or "FF_" prefix
 * @param body     Simple or complex body
 * @param position Position of the name token
 */
public record FeatureFlag(String name, FeatureFlagBody body, Position position) {
}
