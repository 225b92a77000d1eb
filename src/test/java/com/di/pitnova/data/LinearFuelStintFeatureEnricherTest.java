package com.di.pitnova.data;

import com.di.pitnova.agent.optimizer.FuelSchedule;
import com.di.pitnova.agent.validation.PitStopRecord;
import com.di.pitnova.model.Compound;
import com.di.pitnova.model.LapRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LinearFuelStintFeatureEnricher Tests")
class LinearFuelStintFeatureEnricherTest {

    private final LinearFuelStintFeatureEnricher enricher = new LinearFuelStintFeatureEnricher(FuelSchedule.DEFAULT);

    @Test
    @DisplayName("Stints split after each in-lap and lap-in-stint restarts at 1")
    void stintBoundaries() {
        List<LapRecord> out = enricher.enrich(laps("44", 70), List.of(stop("44", 25), stop("44", 10)));

        assertEquals(1, out.get(9).getStintId());
        assertEquals(10, out.get(9).getLapInStint());
        assertEquals(2, out.get(10).getStintId());
        assertEquals(1, out.get(10).getLapInStint());
        assertEquals(15, out.get(24).getLapInStint());
        assertEquals(3, out.get(25).getStintId());
        assertEquals(1, out.get(25).getLapInStint());
    }

    @Test
    @DisplayName("Fuel follows the linear schedule and clamps at the minimum")
    void fuel() {
        List<LapRecord> out = enricher.enrich(laps("44", 70), List.of());

        assertEquals(110.0, out.get(0).getFuelKg(), 1e-12);
        assertEquals(92.0, out.get(10).getFuelKg(), 1e-9);
        assertEquals(0.0, out.get(69).getFuelKg(), 1e-12);
    }

    @Test
    @DisplayName("Stops of other drivers do not split a driver's stint")
    void perDriver() {
        List<LapRecord> laps = new ArrayList<>(laps("44", 30));
        laps.addAll(laps("16", 30));

        List<LapRecord> out = enricher.enrich(laps, List.of(stop("16", 12)));

        assertEquals(20, out.get(19).getLapInStint());
        assertEquals(1, out.get(19).getStintId());
        assertEquals(8, out.get(49).getLapInStint());
        assertEquals(2, out.get(49).getStintId());
    }

    private static List<LapRecord> laps(String driver, int n) {
        List<LapRecord> laps = new ArrayList<>();
        for (int lap = 1; lap <= n; lap++) {
            laps.add(LapRecord.builder().trackId("monza").driverNumber(driver)
                    .lapNumber(lap).compound(Compound.MEDIUM).lapTimeSec(82.0).build());
        }
        return laps;
    }

    private static PitStopRecord stop(String driver, int lap) {
        return PitStopRecord.builder().driverNumber(driver).lapNumber(lap).newCompound(Compound.HARD).build();
    }
}
