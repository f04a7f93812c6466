package com.flaglang.interpreter;

import com.flaglang.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variable bindings used to resolve identifiers during evaluation.
 * Immutable after creation; build a new context to change bindings.
 */
public final class EvaluationContext {

    private static final EvaluationContext EMPTY = new EvaluationContext(Map.of());

    private final Map<String, Value> variables;

    private EvaluationContext(Map<String, Value> variables) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    /**
     * Create a context from plain Java values.
     *
     * @throws IllegalArgumentException if a value is null or of an unsupported type
     */
    public static EvaluationContext of(Map<String, ?> variables) {
        Builder builder = builder();
        variables.forEach(builder::variable);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Value> lookup(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public Map<String, Value> getVariables() {
        return variables;
    }

    @Override
    public String toString() {
        return "EvaluationContext" + variables;
    }

    /**
     * Builder for EvaluationContext.
     */
    public static final class Builder {

        private final Map<String, Value> variables = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder variable(String name, Object value) {
            variables.put(name, Value.of(value));
            return this;
        }

        public Builder variables(Map<String, ?> values) {
            values.forEach(this::variable);
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(variables);
        }
    }
}
