package org.gudu0.progression.counters;

import org.gudu0.progression.util.ConsoleLog;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapping from progress key to a non-negative counter value.
 * <p>
 * Not thread-safe on its own; the engine serializes access under its lock.
 * Monotonicity is a caller convention, {@link #set(String, long)} may lower a value.
 */
public class CounterStore {
    private final Map<String, Long> values = new LinkedHashMap<>();

    /**
     * Adds {@code delta} to the counter and returns the new value.
     * Negative deltas and blank keys are ignored (the current value is returned).
     */
    public long increment(String key, long delta) {
        if (isBlank(key)) {
            ConsoleLog.debug("Counters", "Ignoring increment for blank key");
            return 0;
        }
        long current = get(key);
        if (delta < 0) {
            ConsoleLog.debug("Counters", "Ignoring negative delta key=" + key + " delta=" + delta);
            return current;
        }

        long next = current + delta;
        if (next < current) next = Long.MAX_VALUE; // saturate
        values.put(key, next);
        return next;
    }

    /**
     * Sets the counter to {@code value} and returns the previous value.
     * Negative values and blank keys are ignored.
     */
    public long set(String key, long value) {
        if (isBlank(key)) {
            ConsoleLog.debug("Counters", "Ignoring set for blank key");
            return 0;
        }
        long old = get(key);
        if (value < 0) {
            ConsoleLog.debug("Counters", "Ignoring negative set key=" + key + " value=" + value);
            return old;
        }
        values.put(key, value);
        return old;
    }

    public long get(String key) {
        if (key == null) return 0;
        Long v = values.get(key);
        return v != null ? v : 0L;
    }

    public CounterSnapshot snapshot() {
        return CounterSnapshot.of(values);
    }

    /** Replaces every counter with the given values (used when restoring a save). */
    public void restore(Map<String, Long> restored) {
        values.clear();
        if (restored == null) return;
        for (Map.Entry<String, Long> e : restored.entrySet()) {
            if (isBlank(e.getKey()) || e.getValue() == null || e.getValue() < 0) continue;
            values.put(e.getKey(), e.getValue());
        }
    }

    private static boolean isBlank(String key) {
        return key == null || key.isBlank();
    }
}
