package com.di.pitnova.agent.degradation;

import com.di.pitnova.model.Compound;
import com.di.pitnova.model.DegradationKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryModelStore Tests")
class InMemoryModelStoreTest {

    @Test
    @DisplayName("put replaces per key; keys are sorted; remove and reset clear entries")
    void lifecycle() {
        InMemoryModelStore store = new InMemoryModelStore();
        store.put(model("monza", Compound.HARD, 0.1));
        store.put(model("bahrain", Compound.SOFT, 0.2));
        store.put(model("bahrain", Compound.SOFT, 0.3));

        assertEquals(2, store.size());
        assertEquals(List.of(DegradationKey.of("bahrain", Compound.SOFT), DegradationKey.of("monza", Compound.HARD)),
                store.keys());
        assertEquals(0.3, store.find(DegradationKey.of("bahrain", Compound.SOFT)).orElseThrow().getLapInStintCoef());

        assertTrue(store.remove(DegradationKey.of("monza", Compound.HARD)));
        assertFalse(store.remove(DegradationKey.of("monza", Compound.HARD)));
        assertEquals(1, store.size());

        store.reset();
        assertEquals(0, store.size());
        assertTrue(store.find(DegradationKey.of("bahrain", Compound.SOFT)).isEmpty());
    }

    @Test
    @DisplayName("replaceAll swaps the whole content; snapshot is read-only")
    void replaceAllAndSnapshot() {
        InMemoryModelStore store = new InMemoryModelStore();
        store.put(model("monaco", Compound.MEDIUM, 0.05));

        store.replaceAll(List.of(model("spa", Compound.SOFT, 0.2), model("spa", Compound.HARD, 0.07)));

        assertEquals(List.of(DegradationKey.of("spa", Compound.SOFT), DegradationKey.of("spa", Compound.HARD)),
                store.keys());
        assertThrows(UnsupportedOperationException.class, () -> store.snapshot().clear());
        assertTrue(store.find(null).isEmpty());
    }

    private static FittedDegradationModel model(String track, Compound compound, double slope) {
        return FittedDegradationModel.builder()
                .trackId(track).compound(compound)
                .intercept(90.0).lapInStintCoef(slope)
                .sampleCount(10).usable(true).coefficientOfDetermination(0.9)
                .fittedAt(Instant.EPOCH)
                .build();
    }
}
