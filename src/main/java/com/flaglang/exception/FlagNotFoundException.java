package com.flaglang.exception;

/**
 * Exception thrown when a requested feature flag is not declared in the source.
 */
public class FlagNotFoundException extends FlagLangException {

    private final String flagName;

    public FlagNotFoundException(String flagName) {
        super("Feature flag '" + flagName + "' not found");
        this.flagName = flagName;
    }

    public String getFlagName() {
        return flagName;
    }
}
