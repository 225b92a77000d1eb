package com.di.pitnova.controller.dto;

import com.di.pitnova.agent.optimizer.RankedCandidate;
import com.di.pitnova.model.Compound;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ranked strategy in API form. {@code pitLap} is null for stay-out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateView {
    private int rank;
    private Integer pitLap;
    private boolean stayOut;
    private Compound compoundAfter;
    private double totalTimeSec;
    private double deltaFromBestSec;

    public static CandidateView from(RankedCandidate c) {
        return CandidateView.builder()
                .rank(c.rank())
                .pitLap(c.pitLap().orElse(null))
                .stayOut(c.isStayOut())
                .compoundAfter(c.candidate().compoundAfter())
                .totalTimeSec(c.totalTimeSec())
                .deltaFromBestSec(c.deltaFromBestSec())
                .build();
    }
}
