package org.gudu0.progression.events;

import org.gudu0.progression.achievements.AchievementCategory;
import org.gudu0.progression.achievements.AchievementRarity;

import java.util.Map;

public record AchievementUnlocked(String achievementId, AchievementCategory category, AchievementRarity rarity)
        implements ProgressionEvent {

    @Override
    public String name() {
        return "achievement_unlocked";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of(
                "achievement_id", achievementId,
                "achievement_type", category.name(),
                "rarity", rarity.name()
        );
    }
}
