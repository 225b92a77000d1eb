package com.di.pitnova.agent.optimizer;

import com.di.pitnova.model.Compound;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * The race state at which a pit decision is evaluated.
 * {@code windowLaps} and {@code fuelSchedule} fall back to {@link OptimizerProperties} when null.
 */
@Value
@With
@Builder
@Jacksonized
public class DecisionPoint {
    /** Race lap about to start, 1-based. */
    int currentLap;
    Compound currentCompound;
    /** Lap on the current tyre set at {@code currentLap}, 1-based. */
    int lapInStint;
    int totalRaceLaps;
    String trackId;
    Compound newCompound;
    Integer windowLaps;
    FuelSchedule fuelSchedule;
    Double trackTemp;
}
