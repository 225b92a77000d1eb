package com.di.pitnova.agent.degradation;

import com.di.pitnova.model.Compound;

/**
 * Source of projected lap times for the optimizer. Implemented by {@link DegradationModelService};
 * sensitivity analysis wraps it to perturb degradation.
 */
@FunctionalInterface
public interface LapTimePredictor {

    /**
     * @param trackTemp track temperature, or null when unknown
     * @throws com.di.pitnova.exception.ModelNotFittedException when no model serves the key
     */
    double predictLapTime(String trackId, Compound compound, int lapInStint, double fuelKg, Double trackTemp);
}
