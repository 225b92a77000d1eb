package com.di.pitnova.data;

import com.di.pitnova.agent.validation.PitStopRecord;
import com.di.pitnova.model.LapRecord;

import java.util.List;

/**
 * Derives stint id, lap-in-stint and estimated fuel load for raw laps.
 */
public interface StintFeatureEnricher {

    /** Returns new lap records in input order; the input is not modified. */
    List<LapRecord> enrich(List<LapRecord> laps, List<PitStopRecord> pitStops);
}
