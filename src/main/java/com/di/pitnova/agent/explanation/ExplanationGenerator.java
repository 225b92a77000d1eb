package com.di.pitnova.agent.explanation;

import com.di.pitnova.agent.optimizer.DecisionPoint;
import com.di.pitnova.agent.optimizer.OptimizationResult;
import com.di.pitnova.agent.optimizer.RankedCandidate;
import com.di.pitnova.model.Compound;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns an {@link OptimizationResult} into human-readable prose.
 *
 * <p>Pure function of its inputs: numbers come from the result, the pit loss and the degradation
 * rate only. No simulation is rerun and identical inputs give identical text.
 */
@Component
public class ExplanationGenerator {

    /** Explains using the decision point and pit loss recorded in the result. */
    public StrategyExplanation explain(OptimizationResult result, DegradationRateLookup degradationRateLookup) {
        DecisionPoint dp = result.getDecisionPoint();
        return explain(result, dp.getTrackId(), dp.getCurrentCompound(), degradationRateLookup, result.getPitLossSec());
    }

    public StrategyExplanation explain(OptimizationResult result,
                                       String trackId,
                                       Compound currentCompound,
                                       DegradationRateLookup degradationRateLookup,
                                       double pitLossSec) {
        if (result == null || result.getCandidates().isEmpty()) {
            throw new IllegalArgumentException("Cannot explain an empty optimization result");
        }
        double rate = degradationRateLookup.degradationRate(trackId, currentCompound);
        int currentLap = result.getDecisionPoint().getCurrentLap();
        int totalRaceLaps = result.getDecisionPoint().getTotalRaceLaps();
        RankedCandidate best = result.best();

        Double breakEvenLaps = rate > 0.0 ? pitLossSec / rate : null;
        // null when degradation never catches the pit loss before the flag
        Integer breakEvenLap = null;
        if (breakEvenLaps != null && currentLap + Math.ceil(breakEvenLaps) - 1 <= totalRaceLaps) {
            breakEvenLap = currentLap + (int) Math.ceil(breakEvenLaps) - 1;
        }

        StrategyExplanation.StrategyExplanationBuilder out = StrategyExplanation.builder()
                .pitLossSec(pitLossSec)
                .degradationRateSecPerLap(rate)
                .breakEvenLaps(breakEvenLaps)
                .breakEvenLap(breakEvenLap)
                .recommendation(recommendation(best, currentCompound))
                .whyPitWindowOpens(whyWindowOpens(pitLossSec, rate, currentCompound, breakEvenLaps))
                .whenDegradationOvertakes(whenDegradationOvertakes(pitLossSec, rate, currentLap, totalRaceLaps,
                        breakEvenLaps, breakEvenLap));

        Optional<RankedCandidate> second = result.second();
        if (second.isPresent()) {
            out.deltaToNextBestSec(second.get().deltaFromBestSec());
            out.versusNextBest("The recommended strategy beats the next-best option (" + label(second.get())
                    + ") by " + fmt(second.get().deltaFromBestSec()) + " s.");
        } else {
            out.versusNextBest("No alternative strategy was evaluated.");
        }

        Optional<Integer> pitLap = best.pitLap();
        if (pitLap.isPresent()) {
            int p = pitLap.get();
            Optional<RankedCandidate> earlier = result.findPitLap(p - 1);
            Optional<RankedCandidate> later = result.findPitLap(p + 1);
            earlier.ifPresent(c -> out.costOneLapEarlierSec(c.deltaFromBestSec()));
            later.ifPresent(c -> out.costOneLapLaterSec(c.deltaFromBestSec()));
            out.costOfAdvancing(earlier
                    .map(c -> "Pitting one lap earlier (lap " + (p - 1) + " instead of " + p + ") costs about "
                            + fmt(c.deltaFromBestSec()) + " s.")
                    .orElse("Pitting one lap earlier than lap " + p + " was not evaluated."));
            out.costOfDelaying(later
                    .map(c -> "Pitting one lap later (lap " + (p + 1) + " instead of " + p + ") costs about "
                            + fmt(c.deltaFromBestSec()) + " s.")
                    .orElse("Pitting one lap later than lap " + p + " was not evaluated."));
        } else {
            List<RankedCandidate> pits = result.pitCandidates();
            Optional<RankedCandidate> earliest = pits.stream()
                    .min((a, b) -> Integer.compare(a.pitLap().orElseThrow(), b.pitLap().orElseThrow()));
            Optional<RankedCandidate> latest = pits.stream()
                    .max((a, b) -> Integer.compare(a.pitLap().orElseThrow(), b.pitLap().orElseThrow()));
            if (earliest.isPresent()) {
                int first = earliest.get().pitLap().orElseThrow();
                int last = latest.orElseThrow().pitLap().orElseThrow();
                out.costOneLapEarlierSec(earliest.get().deltaFromBestSec());
                out.costOfAdvancing("No candidate within the evaluated window (laps " + first + "-" + last
                        + ") beats staying out.");
                out.costOfDelaying("Pitting at the earliest evaluated lap (lap " + first + ") costs about "
                        + fmt(earliest.get().deltaFromBestSec()) + " s more than staying out.");
            } else {
                out.costOfAdvancing("No candidate within the evaluated window beats staying out.");
                out.costOfDelaying("No pit stop was evaluated.");
            }
        }

        StrategyExplanation draft = out.build();
        List<String> sections = draft.sections();
        return out
                .summary(String.join(" ", sections))
                .summaryDisplay(sections.stream().map(s -> "• " + s).collect(Collectors.joining("\n")))
                .build();
    }

    private static String recommendation(RankedCandidate best, Compound currentCompound) {
        return best.pitLap()
                .map(lap -> "Recommendation: pit on lap " + lap + " for " + best.candidate().compoundAfter()
                        + " (projected " + fmt(best.totalTimeSec()) + " s to the flag).")
                .orElse("Recommendation: stay out on " + currentCompound + " to the flag (projected "
                        + fmt(best.totalTimeSec()) + " s).");
    }

    private static String whyWindowOpens(double pitLoss, double rate, Compound compound, Double breakEvenLaps) {
        if (breakEvenLaps == null) {
            return "The pit window opens when the time lost to tire degradation would exceed the fixed pit loss ("
                    + fmt(pitLoss) + " s). The degradation rate is zero or negative in the model, so no break-even"
                    + " lap count exists.";
        }
        return "The pit window opens when staying out would cost more than pitting. Pit loss is " + fmt(pitLoss)
                + " s; degradation on " + compound + " tires is " + fmt(rate) + " s per lap, so the break-even"
                + " point is about " + fmt(breakEvenLaps) + " laps.";
    }

    private static String whenDegradationOvertakes(double pitLoss, double rate, int currentLap, int totalRaceLaps,
                                                   Double breakEvenLaps, Integer breakEvenLap) {
        if (breakEvenLaps == null) {
            return "Degradation does not overtake pit loss in the model (degradation rate is zero or negative).";
        }
        if (breakEvenLap == null) {
            return "Counting from lap " + currentLap + ", cumulative degradation at " + fmt(rate)
                    + " s per lap does not overtake the " + fmt(pitLoss) + " s pit loss before the finish on lap "
                    + totalRaceLaps + ".";
        }
        return "Counting from lap " + currentLap + ", cumulative degradation overtakes the " + fmt(pitLoss)
                + " s pit loss by lap " + breakEvenLap + " (" + (int) Math.ceil(breakEvenLaps) + " laps at "
                + fmt(rate) + " s per lap).";
    }

    private static String label(RankedCandidate c) {
        return c.pitLap().map(l -> "pit on lap " + l).orElse("stay out");
    }

    static String fmt(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
