package com.di.pitnova.controller.dto;

import com.di.pitnova.agent.optimizer.DecisionPoint;
import com.di.pitnova.agent.optimizer.FuelSchedule;
import com.di.pitnova.agent.optimizer.OptimizerProperties;
import com.di.pitnova.model.Compound;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for a single pit-window optimization. Unset window and fuel fields use the
 * configured defaults; {@code pitLossSec} overrides the track table when present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizeRequest {

    @NotNull
    @Min(1)
    private Integer currentLap;

    @NotNull
    private Compound currentCompound;

    @NotNull
    @Min(1)
    private Integer lapInStint;

    @NotNull
    @Min(1)
    private Integer totalRaceLaps;

    @NotBlank
    private String trackId;

    @NotNull
    private Compound newCompound;

    @Min(0)
    private Integer windowLaps;

    @PositiveOrZero
    private Double initialFuelKg;

    @PositiveOrZero
    private Double fuelPerLapKg;

    @PositiveOrZero
    private Double minFuelKg;

    private Double trackTemp;

    @PositiveOrZero
    private Double pitLossSec;

    @Builder.Default
    private boolean includeExplanation = true;

    public DecisionPoint toDecisionPoint(OptimizerProperties defaults) {
        FuelSchedule fuel = new FuelSchedule(
                initialFuelKg != null ? initialFuelKg : defaults.getInitialFuelKg(),
                fuelPerLapKg != null ? fuelPerLapKg : defaults.getFuelPerLapKg(),
                minFuelKg != null ? minFuelKg : defaults.getMinFuelKg());
        return DecisionPoint.builder()
                .currentLap(currentLap)
                .currentCompound(currentCompound)
                .lapInStint(lapInStint)
                .totalRaceLaps(totalRaceLaps)
                .trackId(trackId)
                .newCompound(newCompound)
                .windowLaps(windowLaps)
                .fuelSchedule(fuel)
                .trackTemp(trackTemp)
                .build();
    }
}
