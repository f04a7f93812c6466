package com.flaglang.exception;

/**
 * Exception thrown when an expression cannot be evaluated.
 * Carries the name of the feature flag once it escapes flag evaluation.
 */
public class InterpreterException extends FlagLangException {

    private final String flagName;

    public InterpreterException(String message) {
        super(message);
        this.flagName = null;
    }

    public InterpreterException(String message, String flagName, Throwable cause) {
        super(message, cause);
        this.flagName = flagName;
    }

    /**
     * Name of the flag being evaluated, or null for a bare expression.
     */
    public String getFlagName() {
        return flagName;
    }
}
