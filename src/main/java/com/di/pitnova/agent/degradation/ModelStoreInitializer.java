package com.di.pitnova.agent.degradation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Restores the persisted degradation models at startup so the optimizer can serve requests
 * without a refit. A missing snapshot is not an error.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class ModelStoreInitializer implements ApplicationRunner {

    private final DegradationModelService degradationModelService;
    private final DegradationProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isLoadOnStartup()) {
            log.info("[DEGRADATION] startup restore disabled (pitnova.degradation.load-on-startup=false)");
            return;
        }
        Path snapshot = properties.getSnapshotPath();
        if (!Files.exists(snapshot)) {
            log.info("[DEGRADATION] no model snapshot at {}; store starts empty", snapshot.toAbsolutePath());
            return;
        }
        int loaded = degradationModelService.restore(snapshot);
        log.info("[DEGRADATION] startup restore complete: {} models", loaded);
    }
}
