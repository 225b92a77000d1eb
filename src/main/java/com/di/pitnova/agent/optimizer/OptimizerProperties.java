package com.di.pitnova.agent.optimizer;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults applied to a {@link DecisionPoint} that leaves the window or fuel schedule unset.
 */
@Data
@ConfigurationProperties(prefix = "pitnova.optimizer")
public class OptimizerProperties {

    /** Future laps evaluated after the current one. */
    private int windowLaps = 10;

    private double initialFuelKg = 110.0;
    private double fuelPerLapKg = 1.8;
    private double minFuelKg = 0.0;

    /** Candidates within this many seconds of the best form the reported pit window. */
    private double pitWindowWithinSec = 2.0;

    public FuelSchedule defaultFuelSchedule() {
        return new FuelSchedule(initialFuelKg, fuelPerLapKg, minFuelKg);
    }
}
