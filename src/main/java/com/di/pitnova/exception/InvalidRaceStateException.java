package com.di.pitnova.exception;

/**
 * Thrown for malformed decision-point inputs (lap outside the race, negative window, ...).
 * Raised before any simulation runs.
 */
public class InvalidRaceStateException extends PitStrategyException {

    public InvalidRaceStateException(String message) {
        super(message);
    }
}
