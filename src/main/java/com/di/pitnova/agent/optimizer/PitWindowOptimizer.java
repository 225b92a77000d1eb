package com.di.pitnova.agent.optimizer;

import com.di.pitnova.agent.degradation.DegradationModelService;
import com.di.pitnova.agent.degradation.LapTimePredictor;
import com.di.pitnova.agent.pitloss.PitLossTable;
import com.di.pitnova.exception.InvalidRaceStateException;
import com.di.pitnova.model.Compound;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Simulates pitting on each lap of the window and staying out, and ranks the strategies by total
 * projected time to the flag. Single car; no traffic and no safety car.
 *
 * <p>Pit at lap L: laps {@code currentLap..L} on the current compound continuing the stint, the
 * pit loss, then laps {@code L+1..totalRaceLaps} on the new compound with lap-in-stint restarting
 * at 1. Stay out: every remaining lap on the current compound, no pit loss.
 *
 * <p>Ties rank the earlier pit lap first; stay-out sorts as if pitting after the last lap.
 */
@Slf4j
@Service
public class PitWindowOptimizer {

    private static final Comparator<PitCandidate> RANKING = Comparator
            .comparingDouble(PitCandidate::totalTimeSec)
            .thenComparingInt(c -> c.pitLap().orElse(Integer.MAX_VALUE));

    private final LapTimePredictor defaultPredictor;
    private final PitLossTable pitLossTable;
    private final OptimizerProperties properties;

    @Autowired
    public PitWindowOptimizer(DegradationModelService degradationModelService,
                              PitLossTable pitLossTable,
                              OptimizerProperties properties) {
        this((LapTimePredictor) degradationModelService, pitLossTable, properties);
    }

    public PitWindowOptimizer(LapTimePredictor defaultPredictor,
                              PitLossTable pitLossTable,
                              OptimizerProperties properties) {
        this.defaultPredictor = defaultPredictor;
        this.pitLossTable = pitLossTable != null ? pitLossTable : new PitLossTable();
        this.properties = properties != null ? properties : new OptimizerProperties();
    }

    /** Optimizes with the track's pit loss from the table. */
    public OptimizationResult optimize(DecisionPoint decisionPoint) {
        validate(decisionPoint);
        return optimize(decisionPoint, defaultPredictor, pitLossTable.getPitLoss(decisionPoint.getTrackId()));
    }

    /** Optimizes with an explicit pit loss (what-if). */
    public OptimizationResult optimize(DecisionPoint decisionPoint, double pitLossSec) {
        return optimize(decisionPoint, defaultPredictor, pitLossSec);
    }

    /**
     * Optimizes with an explicit predictor and pit loss.
     *
     * @throws InvalidRaceStateException when the decision point is malformed or outside the race
     * @throws com.di.pitnova.exception.ModelNotFittedException when a needed compound has no model
     */
    public OptimizationResult optimize(DecisionPoint decisionPoint, LapTimePredictor predictor, double pitLossSec) {
        DecisionPoint dp = resolve(validate(decisionPoint));
        if (predictor == null) {
            throw new IllegalArgumentException("predictor cannot be null");
        }
        if (!(pitLossSec >= 0.0) || !Double.isFinite(pitLossSec)) {
            throw new InvalidRaceStateException("Pit loss must be a non-negative number, got " + pitLossSec);
        }

        int total = dp.getTotalRaceLaps();
        int lastPitLap = (int) Math.min((long) dp.getCurrentLap() + dp.getWindowLaps(), total);
        List<PitCandidate> simulated = new ArrayList<>(lastPitLap - dp.getCurrentLap() + 2);

        double stayOut = stintTime(predictor, dp, dp.getCurrentCompound(), dp.getCurrentLap(), total, dp.getLapInStint());
        simulated.add(new PitCandidate.StayOut(dp.getCurrentCompound(), stayOut));

        for (int pitLap = dp.getCurrentLap(); pitLap <= lastPitLap; pitLap++) {
            double onCurrent = stintTime(predictor, dp, dp.getCurrentCompound(), dp.getCurrentLap(), pitLap, dp.getLapInStint());
            double onNew = stintTime(predictor, dp, dp.getNewCompound(), pitLap + 1, total, 1);
            simulated.add(new PitCandidate.PitAtLap(pitLap, dp.getNewCompound(), onCurrent + pitLossSec + onNew));
        }

        simulated.sort(RANKING);
        double bestTime = simulated.get(0).totalTimeSec();
        List<RankedCandidate> ranked = new ArrayList<>(simulated.size());
        for (int i = 0; i < simulated.size(); i++) {
            PitCandidate c = simulated.get(i);
            ranked.add(new RankedCandidate(i + 1, c, c.totalTimeSec() - bestTime));
            if (log.isDebugEnabled()) {
                log.debug("[OPTIMIZER] #{} {} total={}s (+{}s)", i + 1,
                        c.pitLap().map(l -> "pit@" + l).orElse("stay-out"),
                        String.format("%.3f", c.totalTimeSec()),
                        String.format("%.3f", c.totalTimeSec() - bestTime));
            }
        }

        OptimizationResult result = new OptimizationResult(dp, pitLossSec, List.copyOf(ranked));
        log.info("[OPTIMIZER] {} lap {}/{} {}→{} pitLoss={}s: {} candidates, best={}",
                dp.getTrackId(), dp.getCurrentLap(), total, dp.getCurrentCompound(), dp.getNewCompound(),
                pitLossSec, ranked.size(),
                result.recommendedPitLap().map(l -> "pit lap " + l).orElse("stay out"));
        return result;
    }

    /** Rank-1 pit lap, or empty when staying out is best. */
    public Optional<Integer> recommendedPitLap(OptimizationResult result) {
        if (result == null || result.getCandidates().isEmpty()) {
            return Optional.empty();
        }
        return result.recommendedPitLap();
    }

    public Optional<PitWindowRange> pitWindowRange(OptimizationResult result) {
        return pitWindowRange(result, properties.getPitWindowWithinSec());
    }

    /**
     * Earliest and latest pit laps within {@code withinSec} of the best. Empty when the best
     * strategy is staying out or no pit candidate qualifies.
     */
    public Optional<PitWindowRange> pitWindowRange(OptimizationResult result, double withinSec) {
        if (result == null || result.getCandidates().isEmpty() || result.best().isStayOut()) {
            return Optional.empty();
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (RankedCandidate c : result.pitCandidates()) {
            if (c.deltaFromBestSec() <= withinSec) {
                int lap = c.pitLap().orElseThrow();
                min = Math.min(min, lap);
                max = Math.max(max, lap);
            }
        }
        return min == Integer.MAX_VALUE ? Optional.empty() : Optional.of(new PitWindowRange(min, max, withinSec));
    }

    public PitLossTable getPitLossTable() {
        return pitLossTable;
    }

    public OptimizerProperties getProperties() {
        return properties;
    }

    /**
     * Checks the decision point before any simulation.
     *
     * @throws InvalidRaceStateException on the first violated precondition
     */
    public DecisionPoint validate(DecisionPoint dp) {
        if (dp == null) {
            throw new InvalidRaceStateException("Decision point is required");
        }
        if (dp.getTotalRaceLaps() < 1) {
            throw new InvalidRaceStateException("totalRaceLaps must be at least 1, got " + dp.getTotalRaceLaps());
        }
        if (dp.getCurrentLap() < 1 || dp.getCurrentLap() > dp.getTotalRaceLaps()) {
            throw new InvalidRaceStateException("currentLap " + dp.getCurrentLap()
                    + " is outside the race (1.." + dp.getTotalRaceLaps() + ")");
        }
        if (dp.getLapInStint() < 1) {
            throw new InvalidRaceStateException("lapInStint must be at least 1, got " + dp.getLapInStint());
        }
        if (dp.getWindowLaps() != null && dp.getWindowLaps() < 0) {
            throw new InvalidRaceStateException("windowLaps must be non-negative, got " + dp.getWindowLaps());
        }
        if (dp.getTrackId() == null || dp.getTrackId().isBlank()) {
            throw new InvalidRaceStateException("trackId is required");
        }
        if (dp.getCurrentCompound() == null || dp.getNewCompound() == null) {
            throw new InvalidRaceStateException("currentCompound and newCompound are required");
        }
        if (dp.getFuelSchedule() != null && !dp.getFuelSchedule().isValid()) {
            throw new InvalidRaceStateException("Fuel schedule values must be non-negative: " + dp.getFuelSchedule());
        }
        return dp;
    }

    private DecisionPoint resolve(DecisionPoint dp) {
        DecisionPoint out = dp.withTrackId(dp.getTrackId().trim());
        if (out.getWindowLaps() == null) {
            out = out.withWindowLaps(properties.getWindowLaps());
        }
        if (out.getFuelSchedule() == null) {
            out = out.withFuelSchedule(properties.defaultFuelSchedule());
        }
        return out;
    }

    private static double stintTime(LapTimePredictor predictor, DecisionPoint dp, Compound compound,
                                    int fromLap, int toLap, int lapInStintAtFrom) {
        double total = 0.0;
        for (int lap = fromLap; lap <= toLap; lap++) {
            total += predictor.predictLapTime(dp.getTrackId(), compound, lapInStintAtFrom + (lap - fromLap),
                    dp.getFuelSchedule().fuelAtLap(lap), dp.getTrackTemp());
        }
        return total;
    }
}
