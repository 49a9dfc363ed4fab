package org.gudu0.progression.persistence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded contents of one save document. Only mutable state lives here; definitions
 * come from the catalog and are matched by id on restore.
 */
public final class SaveData {
    public final Map<String, Long> counters;
    public final Map<String, AchievementRecord> achievements;
    public final Map<String, CollectionRecord> collections;
    public final long savedAtMillis;

    public SaveData(Map<String, Long> counters,
                    Map<String, AchievementRecord> achievements,
                    Map<String, CollectionRecord> collections,
                    long savedAtMillis) {
        this.counters = freeze(counters);
        this.achievements = freeze(achievements);
        this.collections = freeze(collections);
        this.savedAtMillis = savedAtMillis;
    }

    public static SaveData empty() {
        return new SaveData(Map.of(), Map.of(), Map.of(), 0L);
    }

    public boolean isEmpty() {
        return counters.isEmpty() && achievements.isEmpty() && collections.isEmpty();
    }

    private static <V> Map<String, V> freeze(Map<String, V> m) {
        if (m == null || m.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    /** Persisted mutable fields of one achievement. */
    public record AchievementRecord(boolean unlocked, boolean claimed, Long unlockedAtMillis,
                                    long progress, boolean grantPending) {}

    /**
     * Persisted mutable fields of one collection.
     *
     * @param rewardGranted the completion reward was handed out (or is pending) for this save
     */
    public record CollectionRecord(boolean completed, boolean rewardGranted, boolean grantPending,
                                   Map<String, ItemRecord> items) {
        public CollectionRecord {
            items = items == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(items));
        }
    }

    public record ItemRecord(boolean collected, Long collectedAtMillis) {}
}
