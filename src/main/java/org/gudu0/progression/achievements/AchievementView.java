package org.gudu0.progression.achievements;

import org.gudu0.progression.rewards.RewardManifest;

/**
 * Read-only snapshot of one achievement for UIs and the host.
 */
public record AchievementView(
        String id,
        String name,
        String description,
        AchievementCategory category,
        AchievementRarity rarity,
        boolean unlocked,
        boolean claimed,
        long progress,
        long target,
        Long unlockedAtMillis,
        int priority,
        RewardManifest rewards
) {
    public boolean claimable() {
        return unlocked && !claimed;
    }
}
