package com.di.pitnova.agent.sensitivity;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "pitnova.sensitivity")
public class SensitivityProperties {

    /** Pit loss perturbation, seconds. */
    private double pitLossDeltaSec = 2.0;

    /** Degradation perturbation, seconds per lap in stint. */
    private double degradationDeltaSecPerLap = 0.02;
}
