package com.di.pitnova.agent.pitloss;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pit-loss configuration. Track entries override or extend the built-in table.
 *
 * <pre>
 * pitnova:
 *   pit-loss:
 *     default-seconds: 22.0
 *     vsc-factor: 0.5
 *     tracks:
 *       bahrain: 21.5
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "pitnova.pit-loss")
public class PitLossProperties {

    /** Pit loss for tracks absent from the table. */
    private double defaultSeconds = PitLossTable.DEFAULT_PIT_LOSS_SECONDS;

    /** Multiplier applied under a virtual safety car (what-if only). */
    private double vscFactor = PitLossTable.DEFAULT_VSC_FACTOR;

    /** Track name → seconds. Names are matched case-insensitively after trimming. */
    private Map<String, Double> tracks = new LinkedHashMap<>();
}
