package com.di.pitnova.agent.degradation;

import com.di.pitnova.model.DegradationKey;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds at most one {@link FittedDegradationModel} per {@link DegradationKey}.
 * Lifecycle: construct, fill by fitting or restoring a snapshot, read during optimization and
 * validation, optionally persist or reset. Writes for a key must not race reads of the same key.
 */
public interface ModelStore {

    Optional<FittedDegradationModel> find(DegradationKey key);

    /** Stores the model under its key, replacing any previous model for that key. */
    void put(FittedDegradationModel model);

    /** @return true when a model was removed */
    boolean remove(DegradationKey key);

    /** Replaces the whole content (used when restoring a snapshot). */
    void replaceAll(Collection<FittedDegradationModel> models);

    void reset();

    /** Keys in sorted order. */
    List<DegradationKey> keys();

    /** Immutable copy of the current content, sorted by key. */
    Map<DegradationKey, FittedDegradationModel> snapshot();

    int size();
}
