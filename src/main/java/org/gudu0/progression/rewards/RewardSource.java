package org.gudu0.progression.rewards;

public enum RewardSource {
    ACHIEVEMENT,
    COLLECTION
}
