package com.di.pitnova.agent.validation;

/**
 * A race to validate, resolved through a {@link com.di.pitnova.data.RaceDataSource}.
 */
public record RaceRef(int year, String trackId) {

    public static RaceRef of(int year, String trackId) {
        return new RaceRef(year, trackId);
    }
}
