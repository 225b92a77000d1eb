package com.di.pitnova.controller.dto;

import com.di.pitnova.agent.degradation.FittedDegradationModel;
import com.di.pitnova.model.Compound;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelView {
    private String trackId;
    private Compound compound;
    private int sampleCount;
    private boolean usable;
    private Map<String, Double> coefficients;
    private double coefficientOfDetermination;
    private Instant fittedAt;

    public static ModelView from(FittedDegradationModel m) {
        return ModelView.builder()
                .trackId(m.getTrackId())
                .compound(m.getCompound())
                .sampleCount(m.getSampleCount())
                .usable(m.isUsable())
                .coefficients(m.coefficients())
                .coefficientOfDetermination(m.getCoefficientOfDetermination())
                .fittedAt(m.getFittedAt())
                .build();
    }
}
