package com.di.pitnova.agent.validation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * <pre>
 * pitnova:
 *   validation:
 *     alignment-window-laps: 3
 *     results-dir: data/validation
 *     parallelism: 1
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "pitnova.validation")
public class ValidationProperties {

    /** A recommendation within ± this many laps of the actual stop counts as aligned. */
    private int alignmentWindowLaps = 3;

    private String resultsDir = "data/validation";
    private String detailsFile = "validation_details.csv";
    private String summaryFile = "validation_summary.txt";

    /** Races validated concurrently; 1 runs sequentially. */
    private int parallelism = 1;

    /** Upper bound for a parallel run. */
    private long timeoutMinutes = 30;

    public Path getResultsPath() {
        return Path.of(resultsDir);
    }
}
