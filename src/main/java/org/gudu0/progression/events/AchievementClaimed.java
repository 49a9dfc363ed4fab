package org.gudu0.progression.events;

import java.util.Map;

public record AchievementClaimed(String achievementId) implements ProgressionEvent {

    @Override
    public String name() {
        return "achievement_claimed";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("achievement_id", achievementId);
    }
}
