package com.flaglang.exception;

/**
 * Base exception for the feature flag language.
 */
public class FlagLangException extends RuntimeException {

    public FlagLangException(String message) {
        super(message);
    }

    public FlagLangException(String message, Throwable cause) {
        super(message, cause);
    }
}
