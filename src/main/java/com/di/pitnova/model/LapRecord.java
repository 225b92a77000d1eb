package com.di.pitnova.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * One observed or projected lap. Derived fields (lap-in-stint, stint id, fuel load) are
 * null until supplied by a {@link com.di.pitnova.data.StintFeatureEnricher}.
 */
@Value
@With
@Builder
@Jacksonized
public class LapRecord {
    String trackId;
    /** Driver number or code; null for projected laps. */
    String driverNumber;
    Compound compound;
    /** Absolute race lap number, 1-based. */
    int lapNumber;
    /** 1-based lap on the current tyre set. */
    Integer lapInStint;
    /** 1-based stint index for the driver. */
    Integer stintId;
    /** Estimated fuel mass (kg) at the start of the lap. */
    Double fuelKg;
    /** Track temperature (°C), when recorded. */
    Double trackTemp;
    /** Lap time in seconds. */
    Double lapTimeSec;
}
