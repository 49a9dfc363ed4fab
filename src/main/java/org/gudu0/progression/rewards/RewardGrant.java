package org.gudu0.progression.rewards;

/**
 * A request to apply a manifest, tagged with the achievement or collection that earned it.
 * Consumers can de-duplicate on {@code (source, sourceId)}.
 */
public record RewardGrant(RewardSource source, String sourceId, RewardManifest manifest) {}
