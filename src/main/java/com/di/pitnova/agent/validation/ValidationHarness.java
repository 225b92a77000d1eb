package com.di.pitnova.agent.validation;

import com.di.pitnova.agent.degradation.DegradationModelService;
import com.di.pitnova.agent.optimizer.DecisionPoint;
import com.di.pitnova.agent.optimizer.OptimizationResult;
import com.di.pitnova.agent.optimizer.OptimizerProperties;
import com.di.pitnova.agent.optimizer.PitWindowOptimizer;
import com.di.pitnova.agent.pitloss.PitLossTable;
import com.di.pitnova.data.RaceDataSource;
import com.di.pitnova.data.StintFeatureEnricher;
import com.di.pitnova.exception.ErrorCategory;
import com.di.pitnova.model.Compound;
import com.di.pitnova.model.LapRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Replays the optimizer at every historical pit stop and scores the recommendation against the
 * lap the team actually pitted on.
 *
 * <p>The decision point is the start of the actual in-lap: current compound and lap-in-stint come
 * from that driver's lap record (falling back to the new compound and lap-in-stint 1). Any exception
 * while optimizing one decision becomes an error row; the run always completes.
 *
 * <h3>Concurrency</h3>
 * With {@code parallelism > 1} races run on a fixed pool. Each race fills its own row list and the
 * lists are concatenated in input order, so the output matches a sequential run. The model store
 * must not be written to while a run is in progress.
 */
@Slf4j
@Service
public class ValidationHarness {

    private final PitLossTable pitLossTable;
    private final OptimizerProperties optimizerProperties;
    private final ValidationProperties properties;
    private final StintFeatureEnricher stintFeatureEnricher;

    public ValidationHarness(PitLossTable pitLossTable,
                             OptimizerProperties optimizerProperties,
                             ValidationProperties properties,
                             StintFeatureEnricher stintFeatureEnricher) {
        this.pitLossTable = pitLossTable != null ? pitLossTable : new PitLossTable();
        this.optimizerProperties = optimizerProperties != null ? optimizerProperties : new OptimizerProperties();
        this.properties = properties != null ? properties : new ValidationProperties();
        this.stintFeatureEnricher = stintFeatureEnricher;
    }

    public ValidationReport runValidation(List<RaceData> races, DegradationModelService degradationModel) {
        Objects.requireNonNull(degradationModel, "degradationModel");
        PitWindowOptimizer optimizer = new PitWindowOptimizer(degradationModel, pitLossTable, optimizerProperties);
        List<RaceData> input = races != null ? races : List.of();

        long start = System.currentTimeMillis();
        List<ValidationDecision> rows = properties.getParallelism() > 1 && input.size() > 1
                ? runParallel(input, optimizer)
                : runSequential(input, optimizer);

        ValidationReport report = ValidationReport.of(rows);
        ValidationSummary s = report.getSummary();
        log.info("[VALIDATION] {} races, {} decisions: {} within ±{} ({}%), mean |Δ|={}, {} errors in {} ms",
                input.size(), s.getTotalDecisions(), s.getCountWithin3(), properties.getAlignmentWindowLaps(),
                s.getPctWithin3(), s.getMeanAbsLapDelta(), s.getCountErrors(), System.currentTimeMillis() - start);
        return report;
    }

    /**
     * Loads each referenced race and validates those that load. Races the source rejects (unknown,
     * wet) are skipped with a warning.
     */
    public ValidationReport runValidation(RaceDataSource dataSource, List<RaceRef> races,
                                          DegradationModelService degradationModel) {
        Objects.requireNonNull(dataSource, "dataSource");
        List<RaceData> loaded = new ArrayList<>();
        for (RaceRef ref : races != null ? races : List.<RaceRef>of()) {
            try {
                loaded.add(dataSource.loadRace(ref.year(), ref.trackId()));
            } catch (RuntimeException e) {
                log.warn("[VALIDATION] {} {}: race not loaded, skipping: {}", ref.year(), ref.trackId(), e.getMessage());
            }
        }
        return runValidation(loaded, degradationModel);
    }

    private List<ValidationDecision> runSequential(List<RaceData> races, PitWindowOptimizer optimizer) {
        List<ValidationDecision> rows = new ArrayList<>();
        for (RaceData race : races) {
            rows.addAll(validateRace(race, optimizer));
        }
        return rows;
    }

    private List<ValidationDecision> runParallel(List<RaceData> races, PitWindowOptimizer optimizer) {
        int threads = Math.min(properties.getParallelism(), races.size());
        ThreadFactory tf = r -> { var t = new Thread(r, "validation-race"); t.setDaemon(true); return t; };
        ExecutorService executor = Executors.newFixedThreadPool(threads, tf);

        List<CompletableFuture<List<ValidationDecision>>> futures = new ArrayList<>(races.size());
        for (RaceData race : races) {
            futures.add(CompletableFuture.supplyAsync(() -> validateRace(race, optimizer), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(properties.getTimeoutMinutes(), TimeUnit.MINUTES);
            List<ValidationDecision> rows = new ArrayList<>();
            for (CompletableFuture<List<ValidationDecision>> f : futures) {
                rows.addAll(f.join());
            }
            return rows;
        } catch (TimeoutException e) {
            throw new IllegalStateException("Validation timed out after " + properties.getTimeoutMinutes() + " minutes", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Validation failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Validation interrupted", e);
        } finally {
            executor.shutdown();
        }
    }

    /** All decision rows for one race, in pit-stop order. */
    List<ValidationDecision> validateRace(RaceData race, PitWindowOptimizer optimizer) {
        List<ValidationDecision> rows = new ArrayList<>();
        if (race == null || race.getPitStops().isEmpty()) {
            return rows;
        }
        int totalRaceLaps = race.resolveTotalRaceLaps();
        List<LapRecord> laps = withStintFeatures(race);

        for (PitStopRecord stop : race.getPitStops()) {
            if (stop == null || stop.getLapNumber() == null || stop.getNewCompound() == null) {
                log.debug("[VALIDATION] {} {}: skipping incomplete pit stop {}", race.getYear(), race.getTrackId(), stop);
                continue;
            }
            rows.add(validateDecision(race, totalRaceLaps, laps, stop, optimizer));
        }
        log.info("[VALIDATION] {} {}: {} decisions", race.getYear(), race.getTrackId(), rows.size());
        return rows;
    }

    private ValidationDecision validateDecision(RaceData race, int totalRaceLaps, List<LapRecord> laps,
                                                PitStopRecord stop, PitWindowOptimizer optimizer) {
        int actual = stop.getLapNumber();
        Optional<LapRecord> lapAtStop = findLap(laps, stop.getDriverNumber(), actual);
        Compound current = lapAtStop.map(LapRecord::getCompound).orElse(stop.getNewCompound());
        int lapInStint = lapAtStop.map(LapRecord::getLapInStint).orElse(1);

        ValidationDecision.ValidationDecisionBuilder row = ValidationDecision.builder()
                .year(race.getYear())
                .trackId(race.getTrackId())
                .driverNumber(stop.getDriverNumber())
                .actualPitLap(actual)
                .currentCompound(current)
                .newCompound(stop.getNewCompound())
                .lapInStint(lapInStint);

        try {
            DecisionPoint dp = DecisionPoint.builder()
                    .currentLap(actual)
                    .currentCompound(current)
                    .lapInStint(lapInStint)
                    .totalRaceLaps(totalRaceLaps)
                    .trackId(race.getTrackId())
                    .newCompound(stop.getNewCompound())
                    .windowLaps(optimizerProperties.getWindowLaps())
                    .fuelSchedule(optimizerProperties.defaultFuelSchedule())
                    .build();
            OptimizationResult result = optimizer.optimize(dp);
            Optional<Integer> recommended = optimizer.recommendedPitLap(result);

            if (recommended.isPresent()) {
                int delta = recommended.get() - actual;
                row.recommendedPitLap(recommended.get())
                        .lapDelta(delta)
                        .alignmentWithin3(Math.abs(delta) <= properties.getAlignmentWindowLaps());
            } else {
                row.alignmentWithin3(false);
            }
            return row.error(false).build();
        } catch (RuntimeException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            log.warn("[VALIDATION] {} {} driver {} lap {}: {} [{}]",
                    race.getYear(), race.getTrackId(), stop.getDriverNumber(), actual, e.getMessage(), category);
            return row.error(true)
                    .errorCategory(category)
                    .errorMessage(e.getMessage())
                    .build();
        }
    }

    private List<LapRecord> withStintFeatures(RaceData race) {
        boolean missing = race.getLaps().stream().anyMatch(l -> l.getLapInStint() == null);
        if (missing && stintFeatureEnricher != null) {
            return stintFeatureEnricher.enrich(race.getLaps(), race.getPitStops());
        }
        return race.getLaps();
    }

    private static Optional<LapRecord> findLap(List<LapRecord> laps, String driverNumber, int lapNumber) {
        if (driverNumber == null) return Optional.empty();
        return laps.stream()
                .filter(l -> driverNumber.equals(l.getDriverNumber()) && l.getLapNumber() == lapNumber)
                .findFirst();
    }
}
