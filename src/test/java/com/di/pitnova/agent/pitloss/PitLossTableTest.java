package com.di.pitnova.agent.pitloss;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PitLossTable Tests")
class PitLossTableTest {

    private final PitLossTable table = new PitLossTable();

    @ParameterizedTest
    @ValueSource(strings = {"bahrain", "Bahrain", "  BAHRAIN  "})
    @DisplayName("Lookup ignores case and surrounding whitespace")
    void caseInsensitiveLookup(String track) {
        assertEquals(21.5, table.getPitLoss(track));
        assertTrue(table.isKnownTrack(track));
    }

    @Test
    @DisplayName("Unknown, blank and null tracks fall back to the default")
    void unknownTrackUsesDefault() {
        assertEquals(PitLossTable.DEFAULT_PIT_LOSS_SECONDS, table.getPitLoss("atlantis"));
        assertEquals(PitLossTable.DEFAULT_PIT_LOSS_SECONDS, table.getPitLoss(""));
        assertEquals(PitLossTable.DEFAULT_PIT_LOSS_SECONDS, table.getPitLoss(null));
        assertFalse(table.isKnownTrack("atlantis"));
    }

    @Test
    @DisplayName("VSC scales the pit loss by the configured factor")
    void vscFactor() {
        assertEquals(19.0 * 0.5, table.getPitLoss("monaco", true), 1e-12);
        assertEquals(19.0, table.getPitLoss("monaco", false), 1e-12);
    }

    @Test
    @DisplayName("Override derives a new table and leaves the original untouched")
    void overrideIsCopyOnWrite() {
        PitLossTable overridden = table.withOverride("Monza", 30.0);

        assertEquals(30.0, overridden.getPitLoss("monza"));
        assertEquals(22.5, table.getPitLoss("monza"));
        assertEquals(30.0, overridden.withOverride("atlantis", 18.0).getPitLoss("monza"));
        assertEquals(18.0, overridden.withOverride("atlantis", 18.0).getPitLoss("ATLANTIS"));
    }

    @Test
    @DisplayName("Non-positive or blank overrides are rejected")
    void invalidOverride() {
        assertThrows(IllegalArgumentException.class, () -> table.withOverride("monza", 0.0));
        assertThrows(IllegalArgumentException.class, () -> table.withOverride("monza", -3.0));
        assertThrows(IllegalArgumentException.class, () -> table.withOverride("monza", Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> table.withOverride("  ", 20.0));
    }

    @Test
    @DisplayName("Configured tracks extend the table; non-positive entries are ignored")
    void propertiesMerge() {
        PitLossProperties properties = new PitLossProperties();
        properties.setDefaultSeconds(25.0);
        properties.setTracks(Map.of("Kyalami", 23.5, "monaco", -1.0));

        PitLossTable configured = new PitLossTable(properties);

        assertEquals(23.5, configured.getPitLoss("kyalami"));
        assertEquals(19.0, configured.getPitLoss("monaco"));
        assertEquals(25.0, configured.getPitLoss("atlantis"));
        assertThrows(UnsupportedOperationException.class, () -> configured.asMap().put("x", 1.0));
    }
}
