package org.gudu0.progression.rewards;

/**
 * Applies reward manifests to the player's balances / inventory.
 * The engine only decides what to grant and when.
 */
public interface RewardGrantService {
    void grant(RewardGrant grant) throws RewardGrantException;
}
