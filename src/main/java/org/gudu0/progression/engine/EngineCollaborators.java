package org.gudu0.progression.engine;

import org.gudu0.progression.events.AnalyticsSink;
import org.gudu0.progression.events.NotificationService;
import org.gudu0.progression.rewards.RewardGrantService;

/**
 * External services the engine reports to.
 */
public record EngineCollaborators(NotificationService notifications,
                                  AnalyticsSink analytics,
                                  RewardGrantService rewards) {

    public EngineCollaborators {
        if (rewards == null) throw new IllegalArgumentException("A RewardGrantService is required");
    }
}
