package org.gudu0.progression.rewards;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable list of rewards handed to the {@link RewardGrantService} in one grant.
 */
public record RewardManifest(List<Reward> rewards) {
    private static final RewardManifest NONE = new RewardManifest(List.of());

    public RewardManifest {
        rewards = rewards == null ? List.of() : List.copyOf(rewards);
    }

    public static RewardManifest none() {
        return NONE;
    }

    public static RewardManifest of(Reward... rewards) {
        return new RewardManifest(List.of(rewards));
    }

    public boolean isEmpty() {
        return rewards.isEmpty();
    }

    /** Total amount for a non-item kind, or the total item count for {@link RewardKind#ITEM}. */
    public long total(RewardKind kind) {
        long sum = 0;
        for (Reward r : rewards) if (r.kind() == kind) sum += r.amount();
        return sum;
    }

    @Override
    public String toString() {
        if (rewards.isEmpty()) return "(nothing)";
        return rewards.stream().map(Reward::toString).collect(Collectors.joining(", "));
    }
}
