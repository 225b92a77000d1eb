package com.di.pitnova.agent.sensitivity;

import lombok.Builder;
import lombok.Value;

/**
 * Recommendation under green-flag pit loss versus the fixed-factor VSC what-if.
 * Illustrative only; no safety-car timing is predicted.
 */
@Value
@Builder
public class SafetyCarScenario {
    double normalPitLossSec;
    double vscPitLossSec;
    Integer normalRecommendedLap;
    Integer vscRecommendedLap;
    String message;
}
