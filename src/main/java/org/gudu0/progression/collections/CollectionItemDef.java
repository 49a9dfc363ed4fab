package org.gudu0.progression.collections;

import org.gudu0.progression.config.ConfigurationException;

import java.util.Map;

/**
 * Immutable definition of one collectible item.
 *
 * @param category   free-form tag, e.g. "gems"
 * @param rarity     free-form tag, e.g. "rare"
 * @param properties extra display data, passed through untouched
 */
public record CollectionItemDef(String id, String name, String description,
                                String category, String rarity,
                                Map<String, String> properties) {

    public CollectionItemDef {
        if (id == null || id.isBlank()) throw new ConfigurationException("Collection item id must not be blank");
        name = name == null ? id : name;
        description = description == null ? "" : description;
        category = category == null ? "" : category;
        rarity = rarity == null ? "common" : rarity;
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public CollectionItemDef(String id, String name, String description, String category, String rarity) {
        this(id, name, description, category, rarity, Map.of());
    }
}
