package com.di.pitnova.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one fitted degradation model: a (track, compound) pair.
 * Track ids are trimmed; lookups are otherwise exact.
 */
public record DegradationKey(String trackId, Compound compound) implements Comparable<DegradationKey> {

    private static final Comparator<DegradationKey> ORDER = Comparator
            .comparing(DegradationKey::trackId)
            .thenComparing(DegradationKey::compound);

    public DegradationKey {
        if (trackId == null || trackId.isBlank()) {
            throw new IllegalArgumentException("trackId cannot be null or empty");
        }
        Objects.requireNonNull(compound, "compound");
        trackId = trackId.trim();
    }

    public static DegradationKey of(String trackId, Compound compound) {
        return new DegradationKey(trackId, compound);
    }

    public static DegradationKey of(String trackId, String compound) {
        return new DegradationKey(trackId, Compound.fromName(compound));
    }

    @Override
    public int compareTo(DegradationKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return trackId + "/" + compound;
    }
}
