package com.di.pitnova.controller.dto;

import com.di.pitnova.model.Compound;
import com.di.pitnova.model.LapRecord;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Laps to fit from. Without {@code compound} every slick compound present is fitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FitRequest {

    @NotBlank
    private String trackId;

    private Compound compound;

    @Min(2)
    private Integer minSamples;

    @NotEmpty
    private List<LapRecord> laps;
}
