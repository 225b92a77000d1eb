package com.di.pitnova.agent.validation;

import com.di.pitnova.exception.ErrorCategory;
import com.di.pitnova.model.Compound;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One replayed pit decision. On error rows the recommendation, delta and alignment are null.
 * Stay-out recommendations have a null delta and alignment {@code false}.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"year", "track_id", "driver_number", "actual_pit_lap", "recommended_pit_lap", "lap_delta",
        "alignment_within_3", "current_compound", "new_compound", "error", "lap_in_stint",
        "error_category", "error_message"})
public class ValidationDecision {

    @JsonProperty("year")
    int year;

    @JsonProperty("track_id")
    String trackId;

    @JsonProperty("driver_number")
    String driverNumber;

    @JsonProperty("actual_pit_lap")
    int actualPitLap;

    @JsonProperty("recommended_pit_lap")
    Integer recommendedPitLap;

    /** recommended − actual. */
    @JsonProperty("lap_delta")
    Integer lapDelta;

    @JsonProperty("alignment_within_3")
    Boolean alignmentWithin3;

    @JsonProperty("current_compound")
    Compound currentCompound;

    @JsonProperty("new_compound")
    Compound newCompound;

    @JsonProperty("error")
    boolean error;

    @JsonProperty("lap_in_stint")
    Integer lapInStint;

    @JsonProperty("error_category")
    ErrorCategory errorCategory;

    @JsonProperty("error_message")
    String errorMessage;
}
