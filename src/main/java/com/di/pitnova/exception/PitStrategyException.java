package com.di.pitnova.exception;

/**
 * Base type for strategy-engine failures. Caught by {@link GlobalExceptionHandler}
 * and mapped to an HTTP status by subtype.
 */
public class PitStrategyException extends RuntimeException {

    public PitStrategyException(String message) {
        super(message);
    }

    public PitStrategyException(String message, Throwable cause) {
        super(message, cause);
    }
}
