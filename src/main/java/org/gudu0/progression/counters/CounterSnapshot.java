package org.gudu0.progression.counters;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable point-in-time copy of the counters.
 */
public final class CounterSnapshot {
    private static final CounterSnapshot EMPTY = new CounterSnapshot(Map.of());

    private final Map<String, Long> values;

    private CounterSnapshot(Map<String, Long> values) {
        this.values = values;
    }

    public static CounterSnapshot empty() {
        return EMPTY;
    }

    public static CounterSnapshot of(Map<String, Long> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new CounterSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /** Unknown keys read as 0. */
    public long get(String key) {
        Long v = values.get(key);
        return v != null ? v : 0L;
    }

    public Map<String, Long> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }
}
