package org.gudu0.progression.collections;

import java.util.List;

/**
 * Read-only snapshot of one collection.
 */
public record CollectionView(String id, String name, String description,
                             int completionPercentage, boolean completed,
                             List<ItemView> items) {

    public record ItemView(String id, String name, String rarity, boolean collected, Long collectedAtMillis) {}
}
