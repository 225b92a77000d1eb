package com.di.pitnova.agent.explanation;

import com.di.pitnova.model.Compound;

/**
 * Degradation rate (seconds per lap in stint) for a track and compound.
 * Usually {@code degradationModelService::degradationRate}.
 */
@FunctionalInterface
public interface DegradationRateLookup {

    double degradationRate(String trackId, Compound compound);
}
