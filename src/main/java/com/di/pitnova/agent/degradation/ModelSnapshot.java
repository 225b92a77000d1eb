package com.di.pitnova.agent.degradation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of a {@link ModelStore}: a format version plus every model, sorted by key.
 */
@Value
@Builder
@Jacksonized
public class ModelSnapshot {

    public static final int CURRENT_VERSION = 1;

    int version;
    Instant savedAt;
    @Singular
    List<FittedDegradationModel> models;
}
