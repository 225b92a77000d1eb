package com.di.pitnova.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizeResponse {
    private String trackId;
    private int currentLap;
    private int totalRaceLaps;
    private double pitLossSec;
    /** Null means stay out. */
    private Integer recommendedPitLap;
    private Integer pitWindowMin;
    private Integer pitWindowMax;
    private List<CandidateView> candidates;
    private List<String> explanation;
    private String explanationDisplay;
}
