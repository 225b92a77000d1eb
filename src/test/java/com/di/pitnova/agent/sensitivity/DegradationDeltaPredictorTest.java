package com.di.pitnova.agent.sensitivity;

import com.di.pitnova.agent.degradation.LapTimePredictor;
import com.di.pitnova.model.Compound;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DegradationDeltaPredictor Tests")
class DegradationDeltaPredictorTest {

    private final LapTimePredictor base = (track, compound, lis, fuel, temp) -> 90.0 + 0.1 * lis;

    @Test
    @DisplayName("First lap of a stint is unchanged; later laps shift by (lap-in-stint - 1) * delta")
    void shiftsSlopeOnly() {
        DegradationDeltaPredictor plus = new DegradationDeltaPredictor(base, 0.02);
        DegradationDeltaPredictor minus = new DegradationDeltaPredictor(base, -0.02);

        assertEquals(90.1, plus.predictLapTime("x", Compound.SOFT, 1, 50.0, null), 1e-12);
        assertEquals(91.1 + 0.2, plus.predictLapTime("x", Compound.SOFT, 11, 50.0, null), 1e-12);
        assertEquals(91.1 - 0.2, minus.predictLapTime("x", Compound.HARD, 11, 50.0, null), 1e-12);
    }
}
