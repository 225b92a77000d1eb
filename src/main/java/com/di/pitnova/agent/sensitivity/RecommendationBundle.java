package com.di.pitnova.agent.sensitivity;

import lombok.Builder;
import lombok.Value;

/**
 * Everything a strategist needs from one decision point in one object.
 * {@code recommendedLap} null means stay out; window bounds are null when there is no pit window.
 */
@Value
@Builder
public class RecommendationBundle {
    Integer recommendedLap;
    Integer pitWindowMin;
    Integer pitWindowMax;
    /** Bulleted explanation; null when not requested or not derivable. */
    String explanation;
    String sensitivityPitLossMessage;
    String sensitivityDegradationMessage;
    String vscMessage;
}
