package com.di.pitnova.agent.sensitivity;

import com.di.pitnova.agent.degradation.LapTimePredictor;
import com.di.pitnova.model.Compound;

/**
 * Shifts every compound's degradation slope by {@code deltaSecPerLap}: adds
 * {@code (lapInStint - 1) * delta} to the wrapped prediction, so lap 1 of a stint is unchanged.
 */
public class DegradationDeltaPredictor implements LapTimePredictor {

    private final LapTimePredictor delegate;
    private final double deltaSecPerLap;

    public DegradationDeltaPredictor(LapTimePredictor delegate, double deltaSecPerLap) {
        this.delegate = delegate;
        this.deltaSecPerLap = deltaSecPerLap;
    }

    @Override
    public double predictLapTime(String trackId, Compound compound, int lapInStint, double fuelKg, Double trackTemp) {
        return delegate.predictLapTime(trackId, compound, lapInStint, fuelKg, trackTemp)
                + (lapInStint - 1) * deltaSecPerLap;
    }

    public double getDeltaSecPerLap() {
        return deltaSecPerLap;
    }
}
