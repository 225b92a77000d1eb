package com.di.pitnova.agent.degradation;

import lombok.Builder;
import lombok.Value;

/**
 * A predicted lap time plus the inputs actually used. When the model needs track temperature and
 * the caller gave none, {@code temperatureSubstituted} is true and {@code trackTempUsed} holds the
 * training-mean value.
 */
@Value
@Builder
public class LapTimePrediction {
    double lapTimeSec;
    int lapInStint;
    double fuelKg;
    /** Temperature fed into the model; null when the model has no temperature term. */
    Double trackTempUsed;
    boolean temperatureSubstituted;
}
