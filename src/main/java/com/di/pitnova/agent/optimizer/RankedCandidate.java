package com.di.pitnova.agent.optimizer;

import java.util.Optional;

/**
 * A candidate with its 1-based rank and its gap to the best projected time.
 */
public record RankedCandidate(int rank, PitCandidate candidate, double deltaFromBestSec) {

    public Optional<Integer> pitLap() {
        return candidate.pitLap();
    }

    public double totalTimeSec() {
        return candidate.totalTimeSec();
    }

    public boolean isStayOut() {
        return candidate.isStayOut();
    }
}
