package com.di.pitnova.agent.degradation;

import com.di.pitnova.model.Compound;
import com.di.pitnova.model.DegradationKey;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Linear lap-time model for one (track, compound): intercept, degradation slope (s per lap in stint),
 * optional fuel coefficient (s/kg) and optional track temperature coefficient (s/°C).
 * Immutable; refitting produces a new instance that replaces this one in the {@link ModelStore}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FittedDegradationModel {

    public static final String COEF_INTERCEPT = "intercept";
    public static final String COEF_LAP_IN_STINT = "lap_in_stint";
    public static final String COEF_FUEL = "estimated_fuel_kg";
    public static final String COEF_TRACK_TEMP = "track_temp";

    String trackId;
    Compound compound;
    double intercept;
    /** Degradation rate: seconds added per additional lap in stint. */
    double lapInStintCoef;
    /** Null when the model was fitted without fuel load. */
    Double fuelCoef;
    /** Null when the model was fitted without track temperature. */
    Double trackTempCoef;
    /** Mean track temperature of the training laps; substituted when a prediction omits temperature. */
    Double trainingMeanTrackTemp;
    int sampleCount;
    /** False when the model must not serve predictions (e.g. restored below the sample threshold). */
    boolean usable;
    /** R² of the fit on its training laps. */
    double coefficientOfDetermination;
    Instant fittedAt;

    @JsonIgnore
    public DegradationKey getKey() {
        return DegradationKey.of(trackId, compound);
    }

    public boolean usesFuel() {
        return fuelCoef != null;
    }

    public boolean usesTrackTemp() {
        return trackTempCoef != null;
    }

    /** Named coefficients in fit order; absent terms are omitted. */
    public Map<String, Double> coefficients() {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put(COEF_INTERCEPT, intercept);
        out.put(COEF_LAP_IN_STINT, lapInStintCoef);
        if (fuelCoef != null) out.put(COEF_FUEL, fuelCoef);
        if (trackTempCoef != null) out.put(COEF_TRACK_TEMP, trackTempCoef);
        return out;
    }
}
