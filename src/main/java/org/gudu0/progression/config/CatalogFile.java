package org.gudu0.progression.config;

import org.gudu0.progression.achievements.AchievementCategory;
import org.gudu0.progression.achievements.AchievementRarity;
import org.gudu0.progression.rewards.RewardKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a catalog file. Converted to validated definitions by {@link CatalogLoader}.
 */
public class CatalogFile {
    public List<AchievementEntry> achievements = new ArrayList<>();
    public List<CollectionEntry> collections = new ArrayList<>();

    public static class AchievementEntry {
        public String id;
        public String name;
        public String description;
        public AchievementCategory category;
        public AchievementRarity rarity;
        public List<RequirementEntry> requirements = new ArrayList<>();
        public List<RewardEntry> rewards = new ArrayList<>();
        public int priority = 0;
    }

    public static class RequirementEntry {
        public String key;
        public long threshold;
    }

    public static class RewardEntry {
        public RewardKind kind;
        public long amount;
        /** ITEM rewards only. */
        public String itemId;
    }

    public static class CollectionEntry {
        public String id;
        public String name;
        public String description;
        public List<ItemEntry> items = new ArrayList<>();
        public List<RewardEntry> rewards = new ArrayList<>();
    }

    public static class ItemEntry {
        public String id;
        public String name;
        public String description;
        public String category;
        public String rarity;
        public Map<String, String> properties = new LinkedHashMap<>();
    }
}
