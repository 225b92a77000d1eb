package com.di.pitnova.agent.optimizer;

/**
 * Earliest and latest pit laps whose projected time is within {@code withinSec} of the best.
 */
public record PitWindowRange(int earliestLap, int latestLap, double withinSec) {

    public boolean contains(int lap) {
        return lap >= earliestLap && lap <= latestLap;
    }
}
