package com.di.pitnova.agent.optimizer;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Ranked outcome of one optimization: candidates sorted best first, ranks 1..N.
 */
@Value
public class OptimizationResult {
    DecisionPoint decisionPoint;
    double pitLossSec;
    List<RankedCandidate> candidates;

    public RankedCandidate best() {
        return candidates.get(0);
    }

    /** Rank-1 pit lap; empty when staying out is best. */
    public Optional<Integer> recommendedPitLap() {
        return best().pitLap();
    }

    public Optional<RankedCandidate> second() {
        return candidates.size() > 1 ? Optional.of(candidates.get(1)) : Optional.empty();
    }

    public Optional<RankedCandidate> findPitLap(int lap) {
        return candidates.stream()
                .filter(c -> c.pitLap().map(l -> l == lap).orElse(false))
                .findFirst();
    }

    public Optional<RankedCandidate> stayOut() {
        return candidates.stream().filter(RankedCandidate::isStayOut).findFirst();
    }

    public List<RankedCandidate> pitCandidates() {
        return candidates.stream().filter(c -> !c.isStayOut()).toList();
    }
}
