package com.di.pitnova.agent.degradation;

import com.di.pitnova.exception.InsufficientDataException;
import com.di.pitnova.exception.ModelNotFittedException;
import com.di.pitnova.model.Compound;
import com.di.pitnova.model.DegradationKey;
import com.di.pitnova.model.LapRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.di.pitnova.StrategyFixtures.TRACK;
import static com.di.pitnova.StrategyFixtures.linearLaps;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DegradationModelService Tests")
class DegradationModelServiceTest {

    private static final double EPS = 1e-9;

    private InMemoryModelStore store;
    private DegradationModelService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryModelStore();
        service = new DegradationModelService(store, new DegradationProperties(), new ModelSnapshotRepository());
    }

    @Test
    @DisplayName("Exactly linear laps recover intercept and slope")
    void fitRecoversLinearCoefficients() {
        FittedDegradationModel m = service.fit(linearLaps(TRACK, Compound.SOFT, 92.0, 0.2, 10), TRACK, Compound.SOFT);

        assertEquals(92.0, m.getIntercept(), EPS);
        assertEquals(0.2, m.getLapInStintCoef(), EPS);
        assertNull(m.getFuelCoef());
        assertNull(m.getTrackTempCoef());
        assertEquals(10, m.getSampleCount());
        assertTrue(m.isUsable());
        assertEquals(1.0, m.getCoefficientOfDetermination(), 1e-9);
    }

    @Test
    @DisplayName("degradationRate is exactly the stored lap-in-stint coefficient")
    void degradationRateEqualsStoredSlope() {
        service.fit(noisyLaps(Compound.MEDIUM, 20), TRACK, Compound.MEDIUM);
        FittedDegradationModel stored = store.find(DegradationKey.of(TRACK, Compound.MEDIUM)).orElseThrow();

        assertEquals(stored.getLapInStintCoef(), service.degradationRate(TRACK, Compound.MEDIUM), 0.0);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 5, 17, 40})
    @DisplayName("predict is affine in lap-in-stint with the fitted slope")
    void predictIsAffineInLapInStint(int lis) {
        service.fit(noisyLaps(Compound.SOFT, 25), TRACK, Compound.SOFT);
        double slope = service.degradationRate(TRACK, Compound.SOFT);

        double p0 = service.predict(TRACK, Compound.SOFT, lis, 80.0, null);
        double p1 = service.predict(TRACK, Compound.SOFT, lis + 1, 80.0, null);
        double p2 = service.predict(TRACK, Compound.SOFT, lis + 2, 80.0, null);

        assertEquals(slope, p1 - p0, EPS);
        assertEquals(p1 - p0, p2 - p1, EPS);
    }

    @Test
    @DisplayName("Three laps with min samples 5 fails and leaves the store empty")
    void tooFewLapsThrowsAndStoreUntouched() {
        List<LapRecord> laps = linearLaps(TRACK, Compound.SOFT, 92.0, 0.2, 3);

        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> service.fit(laps, TRACK, Compound.SOFT, 5));

        assertEquals(3, e.getFound());
        assertEquals(5, e.getRequired());
        assertEquals(0, store.size());
        assertThrows(ModelNotFittedException.class, () -> service.predict(TRACK, Compound.SOFT, 1, 100.0, null));
    }

    @Test
    @DisplayName("A failed refit keeps the previous model")
    void failedRefitKeepsPreviousModel() {
        FittedDegradationModel first = service.fit(linearLaps(TRACK, Compound.SOFT, 92.0, 0.2, 8), TRACK, Compound.SOFT);

        assertThrows(InsufficientDataException.class,
                () -> service.fit(linearLaps(TRACK, Compound.SOFT, 95.0, 0.5, 2), TRACK, Compound.SOFT));

        assertSame(first, store.find(DegradationKey.of(TRACK, Compound.SOFT)).orElseThrow());
    }

    @Test
    @DisplayName("Refitting a key replaces the model")
    void refitReplaces() {
        service.fit(linearLaps(TRACK, Compound.HARD, 90.0, 0.05, 8), TRACK, Compound.HARD);
        service.fit(linearLaps(TRACK, Compound.HARD, 91.0, 0.10, 8), TRACK, Compound.HARD);

        assertEquals(1, store.size());
        assertEquals(0.10, service.degradationRate(TRACK, Compound.HARD), EPS);
    }

    @Test
    @DisplayName("Laps from other tracks, other compounds or without lap time are ignored")
    void selectionFiltersLaps() {
        List<LapRecord> laps = new ArrayList<>(linearLaps(TRACK, Compound.SOFT, 92.0, 0.2, 6));
        laps.addAll(linearLaps("monza", Compound.SOFT, 80.0, 1.0, 6));
        laps.addAll(linearLaps(TRACK, Compound.HARD, 70.0, 3.0, 6));
        laps.add(LapRecord.builder().trackId(TRACK).compound(Compound.SOFT).lapNumber(7).lapInStint(7).build());

        FittedDegradationModel m = service.fit(laps, " TESTTRACK ", Compound.SOFT);

        assertEquals(6, m.getSampleCount());
        assertEquals(0.2, m.getLapInStintCoef(), EPS);
        assertEquals(TRACK, m.getTrackId().toLowerCase());
    }

    @Test
    @DisplayName("Laps with a non-finite fuel load or track temperature are dropped from the fit")
    void nonFiniteRegressorsDropped() {
        List<LapRecord> laps = new ArrayList<>();
        for (int lap = 1; lap <= 30; lap++) {
            int lis = lap <= 15 ? lap : lap - 15;
            double fuel = 110.0 - (lap - 1) * 1.8;
            laps.add(LapRecord.builder().trackId(TRACK).compound(Compound.MEDIUM).lapNumber(lap)
                    .lapInStint(lis).fuelKg(fuel).lapTimeSec(88.0 + 0.1 * lis + 0.03 * fuel).build());
        }
        laps.set(4, laps.get(4).withFuelKg(Double.NaN));
        laps.set(9, laps.get(9).withTrackTemp(Double.POSITIVE_INFINITY));

        FittedDegradationModel m = service.fit(laps, TRACK, Compound.MEDIUM);

        assertEquals(28, m.getSampleCount());
        assertEquals(0.1, m.getLapInStintCoef(), 1e-6);
        assertEquals(0.03, m.getFuelCoef(), 1e-6);
        assertFalse(m.usesTrackTemp());
    }

    @Test
    @DisplayName("Too few laps left after dropping NaN fuel readings is insufficient data")
    void nonFiniteRegressorsCountAgainstMinimum() {
        List<LapRecord> laps = new ArrayList<>(linearLaps(TRACK, Compound.SOFT, 92.0, 0.2, 5));
        laps.set(2, laps.get(2).withFuelKg(Double.NaN));

        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> service.fit(laps, TRACK, Compound.SOFT));
        assertEquals(4, e.getFound());
        assertTrue(store.keys().isEmpty());
    }

    @Test
    @DisplayName("Fuel load becomes a regressor when laps carry it")
    void fitWithFuel() {
        List<LapRecord> laps = new ArrayList<>();
        // two stints so fuel and lap-in-stint are not collinear
        for (int lap = 1; lap <= 30; lap++) {
            int lis = lap <= 15 ? lap : lap - 15;
            double fuel = 110.0 - (lap - 1) * 1.8;
            laps.add(LapRecord.builder().trackId(TRACK).compound(Compound.MEDIUM).lapNumber(lap)
                    .lapInStint(lis).fuelKg(fuel).lapTimeSec(88.0 + 0.1 * lis + 0.03 * fuel).build());
        }

        FittedDegradationModel m = service.fit(laps, TRACK, Compound.MEDIUM);

        assertEquals(88.0, m.getIntercept(), 1e-6);
        assertEquals(0.1, m.getLapInStintCoef(), 1e-6);
        assertEquals(0.03, m.getFuelCoef(), 1e-6);
        Map<String, Double> coef = service.coefficients(TRACK, Compound.MEDIUM);
        assertEquals(List.of("intercept", "lap_in_stint", "estimated_fuel_kg"), List.copyOf(coef.keySet()));
    }

    @Test
    @DisplayName("Collinear fuel and lap-in-stint still fit and reproduce the training laps")
    void collinearFuelStillFits() {
        List<LapRecord> laps = new ArrayList<>();
        for (int lis = 1; lis <= 12; lis++) {
            double fuel = 110.0 - (lis - 1) * 1.8;
            laps.add(LapRecord.builder().trackId(TRACK).compound(Compound.SOFT).lapNumber(lis)
                    .lapInStint(lis).fuelKg(fuel).lapTimeSec(91.0 + 0.15 * lis).build());
        }

        service.fit(laps, TRACK, Compound.SOFT);

        for (LapRecord lap : laps) {
            assertEquals(lap.getLapTimeSec(),
                    service.predict(TRACK, Compound.SOFT, lap.getLapInStint(), lap.getFuelKg(), null), 1e-6);
        }
    }

    @Test
    @DisplayName("Missing temperature is replaced by the training mean and flagged")
    void temperatureSubstitution() {
        List<LapRecord> laps = new ArrayList<>();
        double[] temps = {30.0, 34.0, 38.0, 32.0, 36.0, 40.0, 31.0, 35.0};
        for (int i = 0; i < temps.length; i++) {
            int lis = i + 1;
            laps.add(LapRecord.builder().trackId(TRACK).compound(Compound.HARD).lapNumber(lis)
                    .lapInStint(lis).trackTemp(temps[i]).lapTimeSec(85.0 + 0.08 * lis + 0.05 * temps[i]).build());
        }
        FittedDegradationModel m = service.fit(laps, TRACK, Compound.HARD);
        assertEquals(34.5, m.getTrainingMeanTrackTemp(), 1e-9);

        LapTimePrediction withoutTemp = service.predictDetailed(TRACK, Compound.HARD, 5, 100.0, null);
        LapTimePrediction withMeanTemp = service.predictDetailed(TRACK, Compound.HARD, 5, 100.0, 34.5);

        assertTrue(withoutTemp.isTemperatureSubstituted());
        assertEquals(34.5, withoutTemp.getTrackTempUsed(), 1e-9);
        assertFalse(withMeanTemp.isTemperatureSubstituted());
        assertEquals(withMeanTemp.getLapTimeSec(), withoutTemp.getLapTimeSec(), 1e-9);
    }

    @Test
    @DisplayName("Temperature is ignored by a model fitted without it")
    void temperatureIgnoredWithoutCoefficient() {
        service.fit(linearLaps(TRACK, Compound.SOFT, 92.0, 0.2, 8), TRACK, Compound.SOFT);

        LapTimePrediction p = service.predictDetailed(TRACK, Compound.SOFT, 3, 100.0, 45.0);

        assertNull(p.getTrackTempUsed());
        assertFalse(p.isTemperatureSubstituted());
        assertEquals(92.6, p.getLapTimeSec(), EPS);
    }

    @Test
    @DisplayName("Predicting an unfitted key names the key")
    void unfittedKeyThrows() {
        ModelNotFittedException e = assertThrows(ModelNotFittedException.class,
                () -> service.predict("monaco", Compound.MEDIUM, 1, 100.0, null));
        assertEquals(DegradationKey.of("monaco", Compound.MEDIUM), e.getKey());
    }

    @Test
    @DisplayName("A model marked unusable does not serve predictions")
    void unusableModelThrows() {
        store.put(FittedDegradationModel.builder()
                .trackId(TRACK).compound(Compound.SOFT)
                .intercept(90.0).lapInStintCoef(0.1)
                .sampleCount(2).usable(false).fittedAt(Instant.now())
                .build());

        assertThrows(ModelNotFittedException.class, () -> service.predict(TRACK, Compound.SOFT, 1, 100.0, null));
        assertFalse(service.isFitted(TRACK, Compound.SOFT));
    }

    @Test
    @DisplayName("fitAll fits every compound with enough laps and skips the rest")
    void fitAllSkipsInsufficientCompounds() {
        List<LapRecord> laps = new ArrayList<>(linearLaps(TRACK, Compound.SOFT, 92.0, 0.2, 8));
        laps.addAll(linearLaps(TRACK, Compound.HARD, 90.0, 0.05, 8));
        laps.addAll(linearLaps(TRACK, Compound.MEDIUM, 91.0, 0.1, 2));

        Map<Compound, FittedDegradationModel> fitted = service.fitAll(laps, TRACK);

        assertEquals(List.of(Compound.SOFT, Compound.HARD), List.copyOf(fitted.keySet()));
        assertEquals(List.of(DegradationKey.of(TRACK, Compound.SOFT), DegradationKey.of(TRACK, Compound.HARD)),
                service.listFitted());
    }

    /** Linear trend plus a deterministic wobble so the fit is not exact. */
    private static List<LapRecord> noisyLaps(Compound compound, int n) {
        List<LapRecord> laps = new ArrayList<>(n);
        for (int lis = 1; lis <= n; lis++) {
            double wobble = ((lis * 7) % 5 - 2) * 0.03;
            laps.add(LapRecord.builder().trackId(TRACK).compound(compound).lapNumber(lis)
                    .lapInStint(lis).lapTimeSec(91.0 + 0.12 * lis + wobble).build());
        }
        return laps;
    }
}
