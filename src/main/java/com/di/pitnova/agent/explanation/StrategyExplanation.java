package com.di.pitnova.agent.explanation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Rule-based rationale for one optimization result. Sentences are fixed templates filled with
 * numbers taken from the result, the pit loss and the degradation rate.
 */
@Value
@Builder
public class StrategyExplanation {

    String recommendation;
    String whyPitWindowOpens;
    String whenDegradationOvertakes;
    String versusNextBest;
    String costOfAdvancing;
    String costOfDelaying;

    /** All sentences joined by a space. */
    String summary;
    /** One bullet per sentence, newline separated. */
    String summaryDisplay;

    double pitLossSec;
    double degradationRateSecPerLap;
    /** pitLoss / rate; null when the rate is not positive. */
    Double breakEvenLaps;
    /** First lap at which cumulative degradation from the decision lap exceeds the pit loss. */
    Integer breakEvenLap;
    Double deltaToNextBestSec;
    Double costOneLapEarlierSec;
    Double costOneLapLaterSec;

    public List<String> sections() {
        return List.of(recommendation, whyPitWindowOpens, whenDegradationOvertakes,
                versusNextBest, costOfAdvancing, costOfDelaying);
    }
}
