package com.di.pitnova.agent.degradation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Binding for degradation-model fitting, persistence and diagnostics.
 *
 * <pre>
 * pitnova:
 *   degradation:
 *     min-samples: 5
 *     models-dir: data/cache/models/degradation
 *     snapshot-file: degradation_models.json
 *     load-on-startup: true
 *     persist-after-fit: false
 *     cliff-slope-change-threshold: 0.05
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "pitnova.degradation")
public class DegradationProperties {

    /** Minimum matching laps for a fit; below this the fit fails. */
    private int minSamples = 5;

    /** Directory holding the model snapshot. */
    private String modelsDir = "data/cache/models/degradation";

    private String snapshotFile = "degradation_models.json";

    /** Restore the snapshot at startup when it exists. */
    private boolean loadOnStartup = true;

    /** Write the snapshot after every successful fit. */
    private boolean persistAfterFit = false;

    /** Minimum slope increase (s/lap) flagged as a cliff candidate. */
    private double cliffSlopeChangeThreshold = 0.05;

    private int curveLapInStintMin = 1;
    private int curveLapInStintMax = 50;

    public Path getSnapshotPath() {
        return Path.of(modelsDir).resolve(snapshotFile);
    }
}
