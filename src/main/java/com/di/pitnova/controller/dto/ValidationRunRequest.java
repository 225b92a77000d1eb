package com.di.pitnova.controller.dto;

import com.di.pitnova.agent.validation.RaceData;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationRunRequest {

    @NotEmpty
    private List<RaceData> races;

    /** Write the results to the configured directory after the run. */
    @Builder.Default
    private boolean save = true;
}
