package com.di.pitnova.agent.sensitivity;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Recommended pit lap at a base parameter value and at base ± delta. Null laps mean stay out.
 */
@Value
@Builder
public class SensitivityResult {

    public enum Parameter { PIT_LOSS, DEGRADATION }

    Parameter parameter;
    double baseValue;
    double delta;
    Integer baseRecommendedLap;
    Integer plusDeltaRecommendedLap;
    Integer minusDeltaRecommendedLap;
    String message;

    public boolean recommendationChanges() {
        return !Objects.equals(baseRecommendedLap, plusDeltaRecommendedLap)
                || !Objects.equals(baseRecommendedLap, minusDeltaRecommendedLap);
    }
}
