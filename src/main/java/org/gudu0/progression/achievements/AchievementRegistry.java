package org.gudu0.progression.achievements;

import org.gudu0.progression.config.ConfigurationException;
import org.gudu0.progression.counters.CounterSnapshot;
import org.gudu0.progression.events.AchievementClaimed;
import org.gudu0.progression.events.AchievementUnlocked;
import org.gudu0.progression.events.EventDispatcher;
import org.gudu0.progression.persistence.SaveData;
import org.gudu0.progression.persistence.StatePersister;
import org.gudu0.progression.requirements.RequirementEvaluator;
import org.gudu0.progression.rewards.RewardGrant;
import org.gudu0.progression.rewards.RewardGrantException;
import org.gudu0.progression.rewards.RewardGrantService;
import org.gudu0.progression.rewards.RewardSource;
import org.gudu0.progression.util.ConsoleLog;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Achievement definitions plus their Locked -> Unlocked -> Claimed state machine.
 * <p>
 * Not thread-safe; the engine calls it under its lock. Runtime calls never throw:
 * unknown ids and invalid transitions are no-ops.
 */
public class AchievementRegistry {
    private final Map<String, AchievementDef> defs = new LinkedHashMap<>();
    private final Map<String, AchievementState> states = new LinkedHashMap<>();

    private final EventDispatcher events;
    private final RewardGrantService rewards;
    private final StatePersister persister;
    private final Clock clock;

    public AchievementRegistry(List<AchievementDef> definitions,
                               EventDispatcher events,
                               RewardGrantService rewards,
                               StatePersister persister,
                               Clock clock) {
        for (AchievementDef def : definitions) {
            if (defs.putIfAbsent(def.id, def) != null) {
                throw new ConfigurationException("Duplicate achievement id: " + def.id);
            }
            states.put(def.id, new AchievementState());
        }
        this.events = events;
        this.rewards = rewards;
        this.persister = persister;
        this.clock = clock;
    }

    /**
     * Re-evaluates every locked achievement against {@code counters}.
     * Locked achievements get their partial progress refreshed; satisfied ones unlock.
     *
     * @return how many achievements unlocked during this pass
     */
    public int evaluate(CounterSnapshot counters) {
        List<AchievementDef> unlockedNow = new ArrayList<>();

        for (AchievementDef def : defs.values()) {
            AchievementState st = states.get(def.id);
            if (st.unlocked) continue;

            RequirementEvaluator.Evaluation ev = RequirementEvaluator.evaluate(def.requirements, counters);
            st.progress = ev.progress();

            if (ev.satisfied()) {
                st.unlocked = true;
                st.unlockedAtMillis = clock.millis();
                unlockedNow.add(def);
                ConsoleLog.info("Achievements", "Unlocked id=" + def.id + " name=\"" + def.name + "\" rarity=" + def.rarity);
            }
        }

        if (unlockedNow.isEmpty()) return 0;

        for (AchievementDef def : unlockedNow) {
            events.dispatch(new AchievementUnlocked(def.id, def.category, def.rarity));
        }
        persister.persistNow();
        return unlockedNow.size();
    }

    /**
     * Claims an unlocked achievement and grants its rewards once.
     *
     * @return true if this call performed the claim
     */
    public boolean claim(String id) {
        AchievementDef def = id == null ? null : defs.get(id);
        if (def == null) {
            ConsoleLog.debug("Achievements", "Claim ignored, unknown id=" + id);
            return false;
        }

        AchievementState st = states.get(id);
        if (!st.isClaimable()) {
            ConsoleLog.debug("Achievements", "Claim ignored id=" + id + " unlocked=" + st.unlocked + " claimed=" + st.claimed);
            return false;
        }

        st.claimed = true;
        st.grantPending = !def.rewards.isEmpty();

        // Record the claim before touching rewards: a crash here leaves a pending grant, never a double grant.
        persister.persistNow();

        if (st.grantPending) {
            attemptGrant(def, st);
        }

        events.dispatch(new AchievementClaimed(id));
        persister.persistNow();
        return true;
    }

    /**
     * Retries grants left pending by a failed or interrupted claim.
     *
     * @return how many pending grants went through
     */
    public int retryPendingGrants() {
        int granted = 0;
        for (AchievementDef def : defs.values()) {
            AchievementState st = states.get(def.id);
            if (!st.grantPending) continue;

            ConsoleLog.info("Achievements", "Retrying pending reward grant id=" + def.id);
            if (attemptGrant(def, st)) granted++;
        }
        if (granted > 0) persister.persistNow();
        return granted;
    }

    private boolean attemptGrant(AchievementDef def, AchievementState st) {
        try {
            rewards.grant(new RewardGrant(RewardSource.ACHIEVEMENT, def.id, def.rewards));
            st.grantPending = false;
            ConsoleLog.info("Achievements", "Granted rewards id=" + def.id + " rewards=[" + def.rewards + "]");
            return true;
        } catch (RewardGrantException e) {
            ConsoleLog.warn("Achievements", "Reward grant failed id=" + def.id + ", will retry: " + e.getMessage());
        } catch (RuntimeException e) {
            ConsoleLog.error("Achievements", "Reward grant crashed id=" + def.id + ", will retry: " + e.getMessage(), e);
        }
        return false;
    }

    public boolean isUnlocked(String id) {
        AchievementState st = id == null ? null : states.get(id);
        return st != null && st.unlocked;
    }

    public boolean isClaimed(String id) {
        AchievementState st = id == null ? null : states.get(id);
        return st != null && st.claimed;
    }

    public boolean isGrantPending(String id) {
        AchievementState st = id == null ? null : states.get(id);
        return st != null && st.grantPending;
    }

    public List<AchievementView> views() {
        List<AchievementView> out = new ArrayList<>(defs.size());
        for (AchievementDef def : defs.values()) out.add(view(def));
        // stable sort keeps definition order within one priority
        out.sort(Comparator.comparingInt(AchievementView::priority));
        return out;
    }

    public List<AchievementView> listUnlocked() {
        List<AchievementView> out = new ArrayList<>();
        for (AchievementView v : views()) if (v.unlocked()) out.add(v);
        return out;
    }

    public List<AchievementView> listClaimable() {
        List<AchievementView> out = new ArrayList<>();
        for (AchievementView v : views()) if (v.claimable()) out.add(v);
        return out;
    }

    private AchievementView view(AchievementDef def) {
        AchievementState st = states.get(def.id);
        return new AchievementView(
                def.id, def.name, def.description, def.category, def.rarity,
                st.unlocked, st.claimed, st.progress, def.target(), st.unlockedAtMillis,
                def.priority, def.rewards
        );
    }

    public Map<String, SaveData.AchievementRecord> toRecords() {
        Map<String, SaveData.AchievementRecord> out = new LinkedHashMap<>();
        for (Map.Entry<String, AchievementState> e : states.entrySet()) {
            out.put(e.getKey(), e.getValue().toRecord());
        }
        return out;
    }

    /**
     * Replaces all state from a save. Configured ids missing from {@code records} go back
     * to locked; ids in {@code records} that are not configured are ignored.
     */
    public void restore(Map<String, SaveData.AchievementRecord> records) {
        for (AchievementState st : states.values()) st.reset();

        for (Map.Entry<String, SaveData.AchievementRecord> e : records.entrySet()) {
            AchievementState st = states.get(e.getKey());
            if (st == null) {
                ConsoleLog.debug("Achievements", "Ignoring saved state for unknown achievement id=" + e.getKey());
                continue;
            }
            st.apply(e.getValue());
        }
    }
}
