package org.gudu0.progression.achievements;

import org.gudu0.progression.config.ConfigurationException;
import org.gudu0.progression.requirements.RequirementSet;
import org.gudu0.progression.rewards.RewardManifest;

/**
 * Immutable achievement definition, supplied by the catalog at startup.
 */
@SuppressWarnings("ClassCanBeRecord")
public class AchievementDef {
    public final String id;
    public final String name;
    public final String description;
    public final AchievementCategory category;
    public final AchievementRarity rarity;
    public final RequirementSet requirements;
    public final RewardManifest rewards;

    /** Display ordering only; lower sorts first. */
    public final int priority;

    public AchievementDef(String id, String name, String description,
                          AchievementCategory category,
                          AchievementRarity rarity,
                          RequirementSet requirements,
                          RewardManifest rewards,
                          int priority) {
        if (id == null || id.isBlank()) throw new ConfigurationException("Achievement id must not be blank");
        if (category == null) throw new ConfigurationException("Achievement " + id + " has no category");
        if (rarity == null) throw new ConfigurationException("Achievement " + id + " has no rarity");
        if (requirements == null) throw new ConfigurationException("Achievement " + id + " has no requirements");

        this.id = id;
        this.name = name == null ? id : name;
        this.description = description == null ? "" : description;
        this.category = category;
        this.rarity = rarity;
        this.requirements = requirements;
        this.rewards = rewards == null ? RewardManifest.none() : rewards;
        this.priority = priority;
    }

    public long target() {
        return requirements.target();
    }
}
