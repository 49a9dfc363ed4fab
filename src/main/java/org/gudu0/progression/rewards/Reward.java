package org.gudu0.progression.rewards;

import org.gudu0.progression.config.ConfigurationException;

/**
 * One line of a reward manifest.
 *
 * @param itemId only set for {@link RewardKind#ITEM}
 */
public record Reward(RewardKind kind, long amount, String itemId) {

    public Reward {
        if (kind == null) throw new ConfigurationException("Reward kind must not be null");
        if (amount <= 0) throw new ConfigurationException("Reward amount must be > 0 (kind=" + kind + ")");
        if (kind == RewardKind.ITEM) {
            if (itemId == null || itemId.isBlank()) {
                throw new ConfigurationException("Item reward needs an itemId");
            }
        } else if (itemId != null) {
            throw new ConfigurationException("Only item rewards carry an itemId (kind=" + kind + ")");
        }
    }

    public static Reward coins(long amount) {
        return new Reward(RewardKind.CURRENCY, amount, null);
    }

    public static Reward gems(long amount) {
        return new Reward(RewardKind.PREMIUM_CURRENCY, amount, null);
    }

    public static Reward item(String itemId, long amount) {
        return new Reward(RewardKind.ITEM, amount, itemId);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CURRENCY -> amount + " coins";
            case PREMIUM_CURRENCY -> amount + " gems";
            case ITEM -> amount + "x " + itemId;
        };
    }
}
