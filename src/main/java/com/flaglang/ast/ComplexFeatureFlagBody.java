package com.flaglang.ast;

import java.util.List;
import java.util.Optional;

/**
 * Rule-based flag body: {@code FF-name { condition -> value ... default }}.
 *
 * @param rules        Rules in declaration order, first match wins
 * @param defaultValue Value used when no rule matches, may be null
 * @param position     Position of the opening brace
 */
public record ComplexFeatureFlagBody(List<Rule> rules, Expression defaultValue, Position position)
        implements FeatureFlagBody {

    public ComplexFeatureFlagBody {
        rules = List.copyOf(rules);
    }

    public Optional<Expression> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }
}
