package org.gudu0.progression.achievements;

import org.gudu0.progression.persistence.SaveData;

/**
 * Mutable per-achievement state. Owned by {@link AchievementRegistry}; never handed out.
 */
final class AchievementState {
    boolean unlocked;
    boolean claimed;
    Long unlockedAtMillis;
    long progress;

    // claimed, but the reward grant has not gone through yet
    boolean grantPending;

    boolean isClaimable() {
        return unlocked && !claimed;
    }

    SaveData.AchievementRecord toRecord() {
        return new SaveData.AchievementRecord(unlocked, claimed, unlockedAtMillis, progress, grantPending);
    }

    void apply(SaveData.AchievementRecord r) {
        unlocked = r.unlocked();
        claimed = r.claimed() && r.unlocked();
        unlockedAtMillis = r.unlocked() ? r.unlockedAtMillis() : null;
        progress = Math.max(0, r.progress());
        grantPending = claimed && r.grantPending();
    }

    void reset() {
        unlocked = false;
        claimed = false;
        unlockedAtMillis = null;
        progress = 0;
        grantPending = false;
    }
}
