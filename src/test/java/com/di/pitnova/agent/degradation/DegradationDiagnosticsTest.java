package com.di.pitnova.agent.degradation;

import com.di.pitnova.StrategyFixtures;
import com.di.pitnova.model.Compound;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.di.pitnova.StrategyFixtures.TRACK;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DegradationDiagnostics Tests")
class DegradationDiagnosticsTest {

    private final DegradationDiagnostics diagnostics =
            new DegradationDiagnostics(StrategyFixtures.fittedService(), new DegradationProperties());

    @Test
    @DisplayName("Curve has one point per lap-in-stint and rises by the slope")
    void curveFollowsModel() {
        List<DegradationDiagnostics.CurvePoint> curve =
                diagnostics.degradationCurve(TRACK, Compound.SOFT, 100.0, null, 1, 10);

        assertEquals(10, curve.size());
        assertEquals(1, curve.get(0).lapInStint());
        assertEquals(StrategyFixtures.SOFT_INTERCEPT + StrategyFixtures.SOFT_SLOPE, curve.get(0).predictedLapTimeSec(), 1e-9);
        assertEquals(StrategyFixtures.SOFT_SLOPE * 9,
                curve.get(9).predictedLapTimeSec() - curve.get(0).predictedLapTimeSec(), 1e-9);
    }

    @Test
    @DisplayName("A linear model has no cliff candidates")
    void linearModelHasNoCliffs() {
        List<DegradationDiagnostics.CliffPoint> points = diagnostics.detectCliffs(TRACK, Compound.HARD, 80.0, null, 1, 30);

        assertTrue(diagnostics.cliffLaps(points).isEmpty());
        assertNull(points.get(0).slopeSecPerLap());
        assertNull(points.get(1).slopeChange());
        assertEquals(StrategyFixtures.HARD_SLOPE, points.get(5).slopeSecPerLap(), 1e-9);
    }

    @Test
    @DisplayName("A jump in slope at or above the threshold is flagged")
    void slopeJumpFlagged() {
        List<DegradationDiagnostics.CurvePoint> curve = List.of(
                new DegradationDiagnostics.CurvePoint(1, 90.0),
                new DegradationDiagnostics.CurvePoint(2, 90.1),
                new DegradationDiagnostics.CurvePoint(3, 90.2),
                new DegradationDiagnostics.CurvePoint(4, 90.5),
                new DegradationDiagnostics.CurvePoint(5, 90.8));

        List<DegradationDiagnostics.CliffPoint> points = DegradationDiagnostics.detectCliffs(curve, 0.05);

        assertEquals(List.of(4), diagnostics.cliffLaps(points));
    }

    @Test
    @DisplayName("Invalid lap range is rejected")
    void invalidRange() {
        assertThrows(IllegalArgumentException.class,
                () -> diagnostics.degradationCurve(TRACK, Compound.SOFT, 100.0, null, 5, 2));
    }
}
