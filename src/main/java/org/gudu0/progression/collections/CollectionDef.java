package org.gudu0.progression.collections;

import org.gudu0.progression.config.ConfigurationException;
import org.gudu0.progression.rewards.RewardManifest;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable collection definition: an ordered list of items and a completion reward.
 */
@SuppressWarnings("ClassCanBeRecord")
public class CollectionDef {
    public final String id;
    public final String name;
    public final String description;
    public final List<CollectionItemDef> items;
    public final RewardManifest completionRewards;

    public CollectionDef(String id, String name, String description,
                         List<CollectionItemDef> items,
                         RewardManifest completionRewards) {
        if (id == null || id.isBlank()) throw new ConfigurationException("Collection id must not be blank");
        if (items == null || items.isEmpty()) throw new ConfigurationException("Collection " + id + " has no items");

        Set<String> seen = new HashSet<>();
        for (CollectionItemDef item : items) {
            if (!seen.add(item.id())) {
                throw new ConfigurationException("Duplicate item id " + item.id() + " in collection " + id);
            }
        }

        this.id = id;
        this.name = name == null ? id : name;
        this.description = description == null ? "" : description;
        this.items = List.copyOf(items);
        this.completionRewards = completionRewards == null ? RewardManifest.none() : completionRewards;
    }

    public CollectionItemDef item(String itemId) {
        for (CollectionItemDef item : items) {
            if (item.id().equals(itemId)) return item;
        }
        return null;
    }
}
