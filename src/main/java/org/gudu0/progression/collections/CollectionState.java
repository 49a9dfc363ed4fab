package org.gudu0.progression.collections;

import org.gudu0.progression.persistence.SaveData;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable per-collection state. Owned by {@link CollectionAggregator}.
 */
final class CollectionState {
    // itemId -> collectedAtMillis; presence means collected
    final Map<String, Long> collectedAt = new LinkedHashMap<>();

    // derived: every item collected
    boolean completed;

    // completion reward handed out (or pending) for this save
    boolean rewardGranted;
    boolean grantPending;

    boolean isCollected(String itemId) {
        return collectedAt.containsKey(itemId);
    }

    int collectedCount() {
        return collectedAt.size();
    }

    SaveData.CollectionRecord toRecord(CollectionDef def) {
        Map<String, SaveData.ItemRecord> items = new LinkedHashMap<>();
        for (CollectionItemDef item : def.items) {
            Long at = collectedAt.get(item.id());
            items.put(item.id(), new SaveData.ItemRecord(at != null, at));
        }
        return new SaveData.CollectionRecord(completed, rewardGranted, grantPending, items);
    }

    void reset() {
        collectedAt.clear();
        completed = false;
        rewardGranted = false;
        grantPending = false;
    }
}
