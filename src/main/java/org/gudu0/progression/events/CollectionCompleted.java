package org.gudu0.progression.events;

import java.util.Map;

public record CollectionCompleted(String collectionId) implements ProgressionEvent {

    @Override
    public String name() {
        return "collection_completed";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("collection_id", collectionId);
    }
}
