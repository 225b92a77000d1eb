package com.di.pitnova.agent.pitloss;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Time lost by making a pit stop, per track, relative to staying on track.
 * Lookup never fails: unknown tracks get the default. The table is immutable once built;
 * {@link #withOverride(String, double)} derives a new one for what-if analysis.
 */
@Slf4j
@Component
public class PitLossTable {

    public static final double DEFAULT_PIT_LOSS_SECONDS = 22.0;
    public static final double DEFAULT_VSC_FACTOR = 0.5;

    private static final Map<String, Double> BUILT_IN;

    static {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("bahrain", 21.5);
        m.put("monaco", 19.0);
        m.put("monza", 22.5);
        m.put("singapore", 24.0);
        m.put("spa", 22.0);
        m.put("silverstone", 22.0);
        m.put("barcelona", 21.5);
        m.put("hungaroring", 21.0);
        m.put("suzuka", 22.5);
        m.put("americas", 22.0);
        m.put("red bull ring", 21.0);
        m.put("zandvoort", 21.5);
        m.put("marina bay", 24.0);
        m.put("losail", 22.0);
        m.put("jeddah", 22.5);
        m.put("abu dhabi", 22.0);
        m.put("miami", 22.0);
        m.put("las vegas", 22.5);
        m.put("imola", 21.5);
        m.put("portimão", 21.5);
        m.put("istanbul", 22.0);
        m.put("sochi", 22.0);
        m.put("shanghai", 22.0);
        m.put("melbourne", 22.0);
        m.put("montreal", 22.0);
        m.put("baku", 21.5);
        m.put("france", 22.0);
        m.put("austria", 21.0);
        m.put("great britain", 22.0);
        m.put("germany", 22.0);
        m.put("italy", 22.5);
        m.put("russia", 22.0);
        m.put("turkey", 22.0);
        m.put("japan", 22.5);
        m.put("mexico", 22.0);
        m.put("brazil", 22.0);
        m.put("qatar", 22.0);
        m.put("saudi arabia", 22.5);
        m.put("netherlands", 21.5);
        m.put("emilia romagna", 21.5);
        m.put("portugal", 21.5);
        m.put("china", 22.0);
        m.put("united states", 22.0);
        BUILT_IN = Collections.unmodifiableMap(m);
    }

    private final Map<String, Double> secondsByTrack;
    private final double defaultSeconds;
    private final double vscFactor;

    @Autowired
    public PitLossTable(PitLossProperties properties) {
        this(merge(properties), positiveOr(properties.getDefaultSeconds(), DEFAULT_PIT_LOSS_SECONDS, "default-seconds"),
                positiveOr(properties.getVscFactor(), DEFAULT_VSC_FACTOR, "vsc-factor"));
        log.info("[PIT-LOSS] table ready: {} tracks, default {}s, VSC factor {}",
                secondsByTrack.size(), defaultSeconds, vscFactor);
    }

    /** Built-in table with default settings. */
    public PitLossTable() {
        this(BUILT_IN, DEFAULT_PIT_LOSS_SECONDS, DEFAULT_VSC_FACTOR);
    }

    private PitLossTable(Map<String, Double> secondsByTrack, double defaultSeconds, double vscFactor) {
        this.secondsByTrack = Collections.unmodifiableMap(new LinkedHashMap<>(secondsByTrack));
        this.defaultSeconds = defaultSeconds;
        this.vscFactor = vscFactor;
    }

    /** Pit loss in seconds for the track; case-insensitive on the trimmed name. */
    public double getPitLoss(String trackId) {
        return secondsByTrack.getOrDefault(normalize(trackId), defaultSeconds);
    }

    /** Pit loss, scaled by the VSC factor when {@code vsc} is true. */
    public double getPitLoss(String trackId, boolean vsc) {
        double base = getPitLoss(trackId);
        return vsc ? base * vscFactor : base;
    }

    /** New table with one track's pit loss replaced; this table is unchanged. */
    public PitLossTable withOverride(String trackId, double seconds) {
        if (!(seconds > 0.0) || !Double.isFinite(seconds)) {
            throw new IllegalArgumentException("Pit loss must be positive, got " + seconds + " for " + trackId);
        }
        String key = normalize(trackId);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("trackId cannot be null or empty");
        }
        Map<String, Double> copy = new LinkedHashMap<>(secondsByTrack);
        copy.put(key, seconds);
        return new PitLossTable(copy, defaultSeconds, vscFactor);
    }

    public boolean isKnownTrack(String trackId) {
        return secondsByTrack.containsKey(normalize(trackId));
    }

    public double getDefaultSeconds() {
        return defaultSeconds;
    }

    public double getVscFactor() {
        return vscFactor;
    }

    public Map<String, Double> asMap() {
        return secondsByTrack;
    }

    static String normalize(String trackId) {
        return trackId == null ? "" : trackId.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Double> merge(PitLossProperties properties) {
        Map<String, Double> merged = new LinkedHashMap<>(BUILT_IN);
        if (properties.getTracks() == null) return merged;
        properties.getTracks().forEach((track, seconds) -> {
            String key = normalize(track);
            if (key.isEmpty()) return;
            if (seconds == null || !(seconds > 0.0) || !Double.isFinite(seconds)) {
                log.warn("[PIT-LOSS] ignoring non-positive pit loss {} for track '{}'", seconds, track);
                return;
            }
            merged.put(key, seconds);
        });
        return merged;
    }

    private static double positiveOr(double value, double fallback, String name) {
        if (value > 0.0 && Double.isFinite(value)) return value;
        log.warn("[PIT-LOSS] ignoring non-positive {} {}; using {}", name, value, fallback);
        return fallback;
    }
}
