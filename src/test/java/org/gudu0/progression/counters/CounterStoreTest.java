package org.gudu0.progression.counters;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CounterStoreTest {

    @Test
    void testUnknownKeyReadsZero() {
        CounterStore store = new CounterStore();
        assertEquals(0, store.get("levels_completed"));
        assertEquals(0, store.get(null));
    }

    @Test
    void testIncrementReturnsNewValue() {
        CounterStore store = new CounterStore();
        assertEquals(3, store.increment("matches_made", 3));
        assertEquals(5, store.increment("matches_made", 2));
        assertEquals(5, store.get("matches_made"));
    }

    @Test
    void testNegativeDeltaIsIgnored() {
        CounterStore store = new CounterStore();
        store.increment("matches_made", 10);

        assertEquals(10, store.increment("matches_made", -4));
        assertEquals(10, store.get("matches_made"));
    }

    @Test
    void testBlankKeyIsIgnored() {
        CounterStore store = new CounterStore();
        assertEquals(0, store.increment(" ", 5));
        assertEquals(0, store.set("", 5));
        assertEquals(0, store.snapshot().size());
    }

    @Test
    void testIncrementSaturates() {
        CounterStore store = new CounterStore();
        store.set("big", Long.MAX_VALUE - 1);

        assertEquals(Long.MAX_VALUE, store.increment("big", 10));
    }

    @Test
    void testSetReturnsPreviousValue() {
        CounterStore store = new CounterStore();
        assertEquals(0, store.set("max_combo", 7));
        assertEquals(7, store.set("max_combo", 12));
        assertEquals(12, store.get("max_combo"));
    }

    @Test
    void testSetNegativeIsIgnored() {
        CounterStore store = new CounterStore();
        store.set("max_combo", 7);

        assertEquals(7, store.set("max_combo", -1));
        assertEquals(7, store.get("max_combo"));
    }

    @Test
    void testSnapshotIsDetached() {
        CounterStore store = new CounterStore();
        store.increment("a", 1);
        CounterSnapshot snap = store.snapshot();

        store.increment("a", 1);

        assertEquals(1, snap.get("a"));
        assertEquals(2, store.get("a"));
        assertThrows(UnsupportedOperationException.class, () -> snap.asMap().put("b", 1L));
    }

    @Test
    void testRestoreReplacesAndSkipsBadValues() {
        CounterStore store = new CounterStore();
        store.increment("old", 9);

        Map<String, Long> saved = new LinkedHashMap<>();
        saved.put("levels_completed", 4L);
        saved.put("broken", -3L);
        saved.put("nothing", null);
        store.restore(saved);

        assertEquals(0, store.get("old"));
        assertEquals(4, store.get("levels_completed"));
        assertEquals(1, store.snapshot().size());
    }
}
