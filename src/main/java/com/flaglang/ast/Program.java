package com.flaglang.ast;

import java.util.List;
import java.util.Optional;

/**
 * Root of a parsed source: feature flags in declaration order.
 * Duplicate names are kept as declared.
 *
 * @param features Feature flag declarations
 * @param position Position of the first token
 */
public record Program(List<FeatureFlag> features, Position position) {

    public Program {
        features = List.copyOf(features);
    }

    /**
     * Find the last declaration with the given name.
     */
    public Optional<FeatureFlag> findFeature(String name) {
        FeatureFlag found = null;
        for (FeatureFlag feature : features) {
            if (feature.name().equals(name)) {
                found = feature;
            }
        }
        return Optional.ofNullable(found);
    }
}
