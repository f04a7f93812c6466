package com.flaglang.evaluator;

import java.util.List;

/**
 * Outcome of validating flag source.
 *
 * @param valid  true when the source scans and parses
 * @param errors Error messages with positions, empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult failed(String error) {
        return new ValidationResult(false, List.of(error));
    }
}
