package com.di.pitnova.agent.optimizer;

/**
 * Linear fuel burn: the load at the start of absolute lap {@code N} is
 * {@code max(minFuelKg, initialFuelKg - (N - 1) * fuelPerLapKg)}. No refuelling, so the schedule
 * runs through pit stops unchanged.
 */
public record FuelSchedule(double initialFuelKg, double fuelPerLapKg, double minFuelKg) {

    public static final FuelSchedule DEFAULT = new FuelSchedule(110.0, 1.8, 0.0);

    public double fuelAtLap(int lapNumber) {
        return Math.max(minFuelKg, initialFuelKg - (lapNumber - 1) * fuelPerLapKg);
    }

    public boolean isValid() {
        return initialFuelKg >= 0.0 && fuelPerLapKg >= 0.0 && minFuelKg >= 0.0
                && Double.isFinite(initialFuelKg) && Double.isFinite(fuelPerLapKg) && Double.isFinite(minFuelKg);
    }
}
