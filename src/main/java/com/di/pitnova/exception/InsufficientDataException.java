package com.di.pitnova.exception;

import com.di.pitnova.model.DegradationKey;

/**
 * Thrown when a fit is requested with fewer matching laps than the minimum sample count.
 * The model store is left unchanged.
 */
public class InsufficientDataException extends PitStrategyException {

    private final transient DegradationKey key;
    private final int found;
    private final int required;

    public InsufficientDataException(DegradationKey key, int found, int required) {
        super(String.format("Too few valid laps for %s: found %d, need at least %d", key, found, required));
        this.key = key;
        this.found = found;
        this.required = required;
    }

    public DegradationKey getKey() {
        return key;
    }

    public int getFound() {
        return found;
    }

    public int getRequired() {
        return required;
    }
}
