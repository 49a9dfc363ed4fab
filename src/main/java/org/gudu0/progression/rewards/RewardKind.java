package org.gudu0.progression.rewards;

public enum RewardKind {
    /** Soft currency ("coins"). */
    CURRENCY,
    /** Premium currency ("gems"). */
    PREMIUM_CURRENCY,
    /** A concrete inventory item, identified by {@link Reward#itemId()}. */
    ITEM
}
