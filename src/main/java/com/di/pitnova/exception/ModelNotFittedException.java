package com.di.pitnova.exception;

import com.di.pitnova.model.DegradationKey;

/**
 * Thrown when a prediction needs a (track, compound) model that is absent from the store
 * or marked unusable.
 */
public class ModelNotFittedException extends PitStrategyException {

    private final transient DegradationKey key;

    public ModelNotFittedException(DegradationKey key) {
        super("No fitted degradation model for " + key + ". Fit the model or restore a snapshot first.");
        this.key = key;
    }

    public ModelNotFittedException(DegradationKey key, String reason) {
        super("Degradation model for " + key + " is not usable: " + reason);
        this.key = key;
    }

    public DegradationKey getKey() {
        return key;
    }
}
