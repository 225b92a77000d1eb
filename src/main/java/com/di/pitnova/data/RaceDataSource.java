package com.di.pitnova.data;

import com.di.pitnova.agent.validation.RaceData;

/**
 * Race-loading contract of the data-ingestion side. Implementations return dry races only
 * (wet sessions are rejected upstream) and are responsible for their own caching.
 */
public interface RaceDataSource {

    /**
     * @throws IllegalArgumentException when the race is unknown or not dry
     */
    RaceData loadRace(int year, String trackId);
}
