package org.gudu0.progression.config;

import org.gudu0.progression.achievements.AchievementCategory;
import org.gudu0.progression.achievements.AchievementDef;
import org.gudu0.progression.collections.CollectionDef;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated static definitions the engine is started with.
 */
public final class Catalog {
    private final List<AchievementDef> achievements;
    private final List<CollectionDef> collections;

    private Catalog(List<AchievementDef> achievements, List<CollectionDef> collections) {
        this.achievements = List.copyOf(achievements);
        this.collections = List.copyOf(collections);
    }

    /**
     * @throws ConfigurationException on duplicate ids or when a category holds more than
     *                                {@code maxPerCategory} achievements
     */
    public static Catalog of(List<AchievementDef> achievements, List<CollectionDef> collections, int maxPerCategory) {
        if (achievements == null) achievements = List.of();
        if (collections == null) collections = List.of();

        Set<String> achievementIds = new HashSet<>();
        Map<AchievementCategory, Integer> perCategory = new EnumMap<>(AchievementCategory.class);
        for (AchievementDef def : achievements) {
            if (!achievementIds.add(def.id)) {
                throw new ConfigurationException("Duplicate achievement id: " + def.id);
            }
            int n = perCategory.merge(def.category, 1, Integer::sum);
            if (n > maxPerCategory) {
                throw new ConfigurationException("Too many achievements in category " + def.category
                        + " (max " + maxPerCategory + ")");
            }
        }

        Set<String> collectionIds = new HashSet<>();
        for (CollectionDef def : collections) {
            if (!collectionIds.add(def.id)) {
                throw new ConfigurationException("Duplicate collection id: " + def.id);
            }
        }

        return new Catalog(achievements, collections);
    }

    public List<AchievementDef> achievements() {
        return achievements;
    }

    public List<CollectionDef> collections() {
        return collections;
    }
}
