package org.gudu0.progression.rewards;

import org.gudu0.progression.util.ConsoleLog;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Console host's reward sink: logs every grant and keeps running totals for the session.
 * A real game would credit its wallet / inventory service here instead.
 */
public class LoggingRewardGrantService implements RewardGrantService {
    private final Map<RewardKind, Long> totals = new EnumMap<>(RewardKind.class);
    private final Map<String, Long> items = new LinkedHashMap<>();

    @Override
    public synchronized void grant(RewardGrant grant) {
        for (Reward r : grant.manifest().rewards()) {
            totals.merge(r.kind(), r.amount(), Long::sum);
            if (r.kind() == RewardKind.ITEM) items.merge(r.itemId(), r.amount(), Long::sum);
        }
        ConsoleLog.info("Rewards", "Granted " + grant.manifest() + " for "
                + grant.source().name().toLowerCase(Locale.ROOT) + " " + grant.sourceId());
    }

    public synchronized long total(RewardKind kind) {
        return totals.getOrDefault(kind, 0L);
    }

    public synchronized Map<String, Long> items() {
        return Map.copyOf(items);
    }
}
