package com.di.pitnova.agent.optimizer;

import com.di.pitnova.model.Compound;

import java.util.Optional;

/**
 * One simulated strategy: pit at a given lap, or stay out to the flag.
 */
public interface PitCandidate {

    /** Projected time from the decision lap to the end of the race, seconds. */
    double totalTimeSec();

    /** Compound on the car at the flag. */
    Compound compoundAfter();

    /** Empty for {@link StayOut}. */
    Optional<Integer> pitLap();

    default boolean isStayOut() {
        return pitLap().isEmpty();
    }

    record PitAtLap(int lap, Compound compoundAfter, double totalTimeSec) implements PitCandidate {
        @Override
        public Optional<Integer> pitLap() {
            return Optional.of(lap);
        }
    }

    record StayOut(Compound compoundAfter, double totalTimeSec) implements PitCandidate {
        @Override
        public Optional<Integer> pitLap() {
            return Optional.empty();
        }
    }
}
