package com.di.pitnova.agent.validation;

import com.di.pitnova.model.LapRecord;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A dry race as supplied by the data-ingestion side: laps for every driver plus pit stops.
 * When {@code totalRaceLaps} is null the highest lap number in {@code laps} is used.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RaceData {
    int year;
    String trackId;
    Integer totalRaceLaps;
    @Singular
    List<LapRecord> laps;
    @Singular
    List<PitStopRecord> pitStops;

    public int resolveTotalRaceLaps() {
        if (totalRaceLaps != null) return totalRaceLaps;
        return laps.stream().mapToInt(LapRecord::getLapNumber).max().orElse(0);
    }
}
