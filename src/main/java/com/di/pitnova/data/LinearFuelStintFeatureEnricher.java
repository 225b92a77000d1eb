package com.di.pitnova.data;

import com.di.pitnova.agent.optimizer.FuelSchedule;
import com.di.pitnova.agent.optimizer.OptimizerProperties;
import com.di.pitnova.agent.validation.PitStopRecord;
import com.di.pitnova.model.LapRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Stints are bounded by pit in-laps: stint 1 runs up to and including the first in-lap, stint k
 * starts on the lap after the (k-1)-th in-lap. Lap-in-stint for stint 1 is the lap number itself.
 * Fuel follows the optimizer's linear {@link FuelSchedule}.
 */
@Component
public class LinearFuelStintFeatureEnricher implements StintFeatureEnricher {

    private final FuelSchedule fuelSchedule;

    @Autowired
    public LinearFuelStintFeatureEnricher(OptimizerProperties properties) {
        this(properties.defaultFuelSchedule());
    }

    public LinearFuelStintFeatureEnricher(FuelSchedule fuelSchedule) {
        this.fuelSchedule = fuelSchedule;
    }

    @Override
    public List<LapRecord> enrich(List<LapRecord> laps, List<PitStopRecord> pitStops) {
        Map<String, List<Integer>> inLapsByDriver = new HashMap<>();
        if (pitStops != null) {
            Map<String, TreeSet<Integer>> sorted = new HashMap<>();
            for (PitStopRecord stop : pitStops) {
                if (stop == null || stop.getDriverNumber() == null || stop.getLapNumber() == null) continue;
                sorted.computeIfAbsent(stop.getDriverNumber(), d -> new TreeSet<>()).add(stop.getLapNumber());
            }
            sorted.forEach((driver, inLaps) -> inLapsByDriver.put(driver, new ArrayList<>(inLaps)));
        }

        List<LapRecord> out = new ArrayList<>(laps.size());
        for (LapRecord lap : laps) {
            List<Integer> inLaps = lap.getDriverNumber() == null
                    ? List.of()
                    : inLapsByDriver.getOrDefault(lap.getDriverNumber(), List.of());
            int stintId = 1;
            for (int inLap : inLaps) {
                if (inLap < lap.getLapNumber()) stintId++;
            }
            int lapInStint = stintId == 1 ? lap.getLapNumber() : lap.getLapNumber() - inLaps.get(stintId - 2);
            out.add(lap.withStintId(stintId)
                    .withLapInStint(Math.max(1, lapInStint))
                    .withFuelKg(fuelSchedule.fuelAtLap(lap.getLapNumber())));
        }
        return out;
    }
}
