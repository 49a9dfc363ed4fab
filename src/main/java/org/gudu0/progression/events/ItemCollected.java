package org.gudu0.progression.events;

import java.util.Map;

public record ItemCollected(String collectionId, String itemId, String rarity) implements ProgressionEvent {

    @Override
    public String name() {
        return "item_collected";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of(
                "collection_id", collectionId,
                "item_id", itemId,
                "rarity", rarity == null ? "" : rarity
        );
    }
}
