package com.di.pitnova.agent.degradation;

import com.di.pitnova.exception.InsufficientDataException;
import com.di.pitnova.exception.ModelNotFittedException;
import com.di.pitnova.model.Compound;
import com.di.pitnova.model.DegradationKey;
import com.di.pitnova.model.LapRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fits, serves and persists per-(track, compound) linear lap-time models.
 *
 * <p>Model: {@code lapTime = intercept + slope * lapInStint [+ fuelCoef * fuelKg] [+ tempCoef * trackTemp]}.
 * Fuel and temperature enter the fit only when at least one selected lap carries them; laps missing a
 * term that is in use are dropped from the sample. The slope is the degradation rate.
 *
 * <p>Fitting fails with {@link InsufficientDataException} and leaves the store untouched when too few
 * laps remain. Prediction for a key without a usable model fails with {@link ModelNotFittedException}.
 */
@Slf4j
@Service
public class DegradationModelService implements LapTimePredictor {

    private final ModelStore store;
    private final DegradationProperties properties;
    private final ModelSnapshotRepository snapshotRepository;

    @Autowired
    public DegradationModelService(ModelStore store,
                                   DegradationProperties properties,
                                   ModelSnapshotRepository snapshotRepository) {
        this.store = Objects.requireNonNull(store, "store");
        this.properties = properties != null ? properties : new DegradationProperties();
        this.snapshotRepository = snapshotRepository != null ? snapshotRepository : new ModelSnapshotRepository();
    }

    /** Standalone service over a fresh in-memory store with default settings. */
    public DegradationModelService() {
        this(new InMemoryModelStore(), new DegradationProperties(), new ModelSnapshotRepository());
    }

    // ---------------------------------------------------------------- fitting

    public FittedDegradationModel fit(List<LapRecord> laps, String trackId, Compound compound) {
        return fit(laps, trackId, compound, properties.getMinSamples());
    }

    public FittedDegradationModel fit(List<LapRecord> laps, String trackId, Compound compound, int minSamples) {
        DegradationKey key = DegradationKey.of(trackId, compound);
        List<LapRecord> selected = select(laps, key);

        boolean useFuel = selected.stream().anyMatch(l -> l.getFuelKg() != null);
        boolean useTemp = selected.stream().anyMatch(l -> l.getTrackTemp() != null);
        List<LapRecord> usable = selected.stream()
                .filter(l -> !useFuel || l.getFuelKg() != null)
                .filter(l -> !useTemp || l.getTrackTemp() != null)
                .toList();

        int params = 2 + (useFuel ? 1 : 0) + (useTemp ? 1 : 0);
        int required = Math.max(minSamples, params + 1);
        if (usable.size() < required) {
            log.warn("[DEGRADATION] fit rejected for {}: {} usable laps of {} selected, need {}",
                    key, usable.size(), selected.size(), required);
            throw new InsufficientDataException(key, usable.size(), required);
        }

        int cols = params - 1;
        double[][] x = new double[usable.size()][cols];
        double[] y = new double[usable.size()];
        double tempSum = 0.0;
        for (int i = 0; i < usable.size(); i++) {
            LapRecord lap = usable.get(i);
            int c = 0;
            x[i][c++] = lap.getLapInStint();
            if (useFuel) x[i][c++] = lap.getFuelKg();
            if (useTemp) {
                x[i][c] = lap.getTrackTemp();
                tempSum += lap.getTrackTemp();
            }
            y[i] = lap.getLapTimeSec();
        }

        LinearRegressionFitter.LinearFit fit = LinearRegressionFitter.fit(x, y);
        double[] coef = fit.coefficients();
        int c = 0;
        FittedDegradationModel model = FittedDegradationModel.builder()
                .trackId(key.trackId())
                .compound(key.compound())
                .intercept(fit.intercept())
                .lapInStintCoef(coef[c++])
                .fuelCoef(useFuel ? coef[c++] : null)
                .trackTempCoef(useTemp ? coef[c] : null)
                .trainingMeanTrackTemp(useTemp ? tempSum / usable.size() : null)
                .sampleCount(usable.size())
                .usable(true)
                .coefficientOfDetermination(fit.rSquared())
                .fittedAt(Instant.now())
                .build();

        store.put(model);
        log.info("[DEGRADATION] fitted {}: n={}, slope={} s/lap, fuel={}, temp={}, R²={}",
                key, model.getSampleCount(), round4(model.getLapInStintCoef()),
                model.usesFuel() ? round4(model.getFuelCoef()) : "-",
                model.usesTrackTemp() ? round4(model.getTrackTempCoef()) : "-",
                round4(model.getCoefficientOfDetermination()));

        if (properties.isPersistAfterFit()) {
            persist();
        }
        return model;
    }

    /**
     * Fits every slick compound present in {@code laps} for the track. Compounds with too few laps
     * are skipped and logged.
     */
    public Map<Compound, FittedDegradationModel> fitAll(List<LapRecord> laps, String trackId) {
        Map<Compound, FittedDegradationModel> fitted = new EnumMap<>(Compound.class);
        for (Compound compound : Compound.values()) {
            boolean present = laps != null && laps.stream().anyMatch(l -> l.getCompound() == compound);
            if (!present) continue;
            try {
                fitted.put(compound, fit(laps, trackId, compound));
            } catch (InsufficientDataException e) {
                log.warn("[DEGRADATION] skipping {}: {}", e.getKey(), e.getMessage());
            }
        }
        return fitted;
    }

    private static List<LapRecord> select(List<LapRecord> laps, DegradationKey key) {
        List<LapRecord> out = new ArrayList<>();
        if (laps == null) return out;
        for (LapRecord lap : laps) {
            if (lap == null || lap.getCompound() != key.compound()) continue;
            if (lap.getTrackId() == null || !lap.getTrackId().trim().equalsIgnoreCase(key.trackId())) continue;
            if (lap.getLapInStint() == null || lap.getLapTimeSec() == null) continue;
            if (!Double.isFinite(lap.getLapTimeSec())) continue;
            if (lap.getFuelKg() != null && !Double.isFinite(lap.getFuelKg())) continue;
            if (lap.getTrackTemp() != null && !Double.isFinite(lap.getTrackTemp())) continue;
            out.add(lap);
        }
        return out;
    }

    // ---------------------------------------------------------------- prediction

    public LapTimePrediction predictDetailed(String trackId, Compound compound, int lapInStint,
                                             double fuelKg, Double trackTemp) {
        FittedDegradationModel model = getModel(trackId, compound);
        double t = model.getIntercept() + model.getLapInStintCoef() * lapInStint;
        if (model.usesFuel()) {
            t += model.getFuelCoef() * fuelKg;
        }
        Double tempUsed = null;
        boolean substituted = false;
        if (model.usesTrackTemp()) {
            if (trackTemp != null) {
                tempUsed = trackTemp;
            } else {
                tempUsed = model.getTrainingMeanTrackTemp();
                substituted = true;
                log.debug("[DEGRADATION] {}: no track temperature given, using training mean {}", model.getKey(), tempUsed);
            }
            t += model.getTrackTempCoef() * tempUsed;
        }
        return LapTimePrediction.builder()
                .lapTimeSec(t)
                .lapInStint(lapInStint)
                .fuelKg(fuelKg)
                .trackTempUsed(tempUsed)
                .temperatureSubstituted(substituted)
                .build();
    }

    public double predict(String trackId, Compound compound, int lapInStint, double fuelKg, Double trackTemp) {
        return predictDetailed(trackId, compound, lapInStint, fuelKg, trackTemp).getLapTimeSec();
    }

    @Override
    public double predictLapTime(String trackId, Compound compound, int lapInStint, double fuelKg, Double trackTemp) {
        return predict(trackId, compound, lapInStint, fuelKg, trackTemp);
    }

    /** Seconds per additional lap in stint; exactly the stored slope. */
    public double degradationRate(String trackId, Compound compound) {
        return getModel(trackId, compound).getLapInStintCoef();
    }

    public Map<String, Double> coefficients(String trackId, Compound compound) {
        return getModel(trackId, compound).coefficients();
    }

    public FittedDegradationModel getModel(String trackId, Compound compound) {
        DegradationKey key = DegradationKey.of(trackId, compound);
        FittedDegradationModel model = store.find(key)
                .orElseThrow(() -> new ModelNotFittedException(key));
        if (!model.isUsable()) {
            throw new ModelNotFittedException(key, "model is marked unusable");
        }
        return model;
    }

    public boolean isFitted(String trackId, Compound compound) {
        return store.find(DegradationKey.of(trackId, compound))
                .map(FittedDegradationModel::isUsable)
                .orElse(false);
    }

    public List<DegradationKey> listFitted() {
        return store.keys();
    }

    public ModelStore getStore() {
        return store;
    }

    // ---------------------------------------------------------------- persistence

    public Path persist() {
        return persist(properties.getSnapshotPath());
    }

    /** Writes the whole store as a JSON snapshot to {@code file}. */
    public Path persist(Path file) {
        snapshotRepository.write(file, store.snapshot().values());
        return file;
    }

    /** Restores the configured snapshot; returns the number of models loaded. */
    public int restore() {
        return restore(properties.getSnapshotPath());
    }

    /**
     * Replaces the store's content with the snapshot at {@code file}. Models with fewer samples than
     * {@code minSamples} are kept but marked unusable.
     */
    public int restore(Path file) {
        if (!Files.exists(file)) {
            throw new IllegalStateException("Model snapshot not found: " + file);
        }
        ModelSnapshot snapshot = snapshotRepository.read(file);
        List<FittedDegradationModel> restored = new ArrayList<>(snapshot.getModels().size());
        for (FittedDegradationModel model : snapshot.getModels()) {
            if (model.isUsable() && model.getSampleCount() < properties.getMinSamples()) {
                log.warn("[DEGRADATION] {} restored with {} samples, below minimum {}; marked unusable",
                        model.getKey(), model.getSampleCount(), properties.getMinSamples());
                model = model.toBuilder().usable(false).build();
            }
            restored.add(model);
        }
        store.replaceAll(restored);
        log.info("[DEGRADATION] restored {} models from {}", store.size(), file);
        return store.size();
    }

    private static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
