package org.gudu0.progression.collections;

import org.gudu0.progression.config.ConfigurationException;
import org.gudu0.progression.counters.CounterStore;
import org.gudu0.progression.events.CollectionCompleted;
import org.gudu0.progression.events.EventDispatcher;
import org.gudu0.progression.events.ItemCollected;
import org.gudu0.progression.persistence.SaveData;
import org.gudu0.progression.persistence.StatePersister;
import org.gudu0.progression.rewards.RewardGrant;
import org.gudu0.progression.rewards.RewardGrantException;
import org.gudu0.progression.rewards.RewardGrantService;
import org.gudu0.progression.rewards.RewardSource;
import org.gudu0.progression.util.ConsoleLog;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks collected items per collection and completes collections when every item is in.
 * <p>
 * Every first-time collection bumps the {@value #ITEMS_COLLECTED} counter, which achievements
 * can require. Not thread-safe; the engine calls it under its lock.
 */
public class CollectionAggregator {
    public static final String ITEMS_COLLECTED = "items_collected";

    private final Map<String, CollectionDef> defs = new LinkedHashMap<>();
    private final Map<String, CollectionState> states = new LinkedHashMap<>();

    private final CounterStore counters;
    private final EventDispatcher events;
    private final RewardGrantService rewards;
    private final StatePersister persister;
    private final Clock clock;

    public CollectionAggregator(List<CollectionDef> definitions,
                                CounterStore counters,
                                EventDispatcher events,
                                RewardGrantService rewards,
                                StatePersister persister,
                                Clock clock) {
        for (CollectionDef def : definitions) {
            if (defs.putIfAbsent(def.id, def) != null) {
                throw new ConfigurationException("Duplicate collection id: " + def.id);
            }
            states.put(def.id, new CollectionState());
        }
        this.counters = counters;
        this.events = events;
        this.rewards = rewards;
        this.persister = persister;
        this.clock = clock;
    }

    /**
     * Marks an item collected. Unknown ids and already-collected items are ignored.
     *
     * @return true if the item was newly collected
     */
    public boolean collect(String collectionId, String itemId) {
        CollectionDef def = collectionId == null ? null : defs.get(collectionId);
        if (def == null) {
            ConsoleLog.debug("Collections", "Collect ignored, unknown collection=" + collectionId);
            return false;
        }
        CollectionItemDef item = def.item(itemId);
        if (item == null) {
            ConsoleLog.debug("Collections", "Collect ignored, unknown item=" + itemId + " in collection=" + collectionId);
            return false;
        }

        CollectionState st = states.get(def.id);
        if (st.isCollected(item.id())) {
            ConsoleLog.debug("Collections", "Collect ignored, already collected item=" + itemId);
            return false;
        }

        st.collectedAt.put(item.id(), clock.millis());
        counters.increment(ITEMS_COLLECTED, 1);
        ConsoleLog.info("Collections", "Collected item=" + item.id() + " collection=" + def.id
                + " (" + st.collectedCount() + "/" + def.items.size() + ")");

        events.dispatch(new ItemCollected(def.id, item.id(), item.rarity()));

        if (!checkCompletion(def, st)) {
            persister.persistNow();
        }
        return true;
    }

    /**
     * Re-derives completion for every collection. Already-completed collections are untouched.
     *
     * @return how many collections completed during this pass
     */
    public int evaluate() {
        int completed = 0;
        for (CollectionDef def : defs.values()) {
            if (checkCompletion(def, states.get(def.id))) completed++;
        }
        return completed;
    }

    /** @return true if this call performed the completion transition */
    private boolean checkCompletion(CollectionDef def, CollectionState st) {
        boolean all = st.collectedCount() == def.items.size();
        st.completed = all;
        if (!all || st.rewardGranted) return false;

        st.rewardGranted = true;
        st.grantPending = !def.completionRewards.isEmpty();
        ConsoleLog.info("Collections", "Completed collection=" + def.id + " name=\"" + def.name + "\"");

        persister.persistNow();

        if (st.grantPending) {
            attemptGrant(def, st);
        }

        events.dispatch(new CollectionCompleted(def.id));
        persister.persistNow();
        return true;
    }

    public int retryPendingGrants() {
        int granted = 0;
        for (CollectionDef def : defs.values()) {
            CollectionState st = states.get(def.id);
            if (!st.grantPending) continue;

            ConsoleLog.info("Collections", "Retrying pending completion reward collection=" + def.id);
            if (attemptGrant(def, st)) granted++;
        }
        if (granted > 0) persister.persistNow();
        return granted;
    }

    private boolean attemptGrant(CollectionDef def, CollectionState st) {
        try {
            rewards.grant(new RewardGrant(RewardSource.COLLECTION, def.id, def.completionRewards));
            st.grantPending = false;
            ConsoleLog.info("Collections", "Granted completion rewards collection=" + def.id + " rewards=[" + def.completionRewards + "]");
            return true;
        } catch (RewardGrantException e) {
            ConsoleLog.warn("Collections", "Completion reward failed collection=" + def.id + ", will retry: " + e.getMessage());
        } catch (RuntimeException e) {
            ConsoleLog.error("Collections", "Completion reward crashed collection=" + def.id + ", will retry: " + e.getMessage(), e);
        }
        return false;
    }

    public boolean isCollected(String collectionId, String itemId) {
        CollectionState st = collectionId == null ? null : states.get(collectionId);
        return st != null && st.isCollected(itemId);
    }

    public boolean isCompleted(String collectionId) {
        CollectionState st = collectionId == null ? null : states.get(collectionId);
        return st != null && st.completed;
    }

    public boolean isGrantPending(String collectionId) {
        CollectionState st = collectionId == null ? null : states.get(collectionId);
        return st != null && st.grantPending;
    }

    public static int completionPercentage(int collected, int total) {
        if (total <= 0) return 0;
        return (int) (collected * 100L / total);
    }

    public List<CollectionView> views() {
        List<CollectionView> out = new ArrayList<>(defs.size());
        for (CollectionDef def : defs.values()) {
            CollectionState st = states.get(def.id);

            List<CollectionView.ItemView> items = new ArrayList<>(def.items.size());
            for (CollectionItemDef item : def.items) {
                Long at = st.collectedAt.get(item.id());
                items.add(new CollectionView.ItemView(item.id(), item.name(), item.rarity(), at != null, at));
            }

            out.add(new CollectionView(
                    def.id, def.name, def.description,
                    completionPercentage(st.collectedCount(), def.items.size()),
                    st.completed,
                    List.copyOf(items)
            ));
        }
        return out;
    }

    public Map<String, SaveData.CollectionRecord> toRecords() {
        Map<String, SaveData.CollectionRecord> out = new LinkedHashMap<>();
        for (CollectionDef def : defs.values()) {
            out.put(def.id, states.get(def.id).toRecord(def));
        }
        return out;
    }

    /**
     * Replaces all state from a save. Unknown collections and items are ignored; configured
     * ones missing from the save start uncollected. {@code completed} is re-derived from items.
     */
    public void restore(Map<String, SaveData.CollectionRecord> records) {
        for (CollectionState st : states.values()) st.reset();

        for (Map.Entry<String, SaveData.CollectionRecord> e : records.entrySet()) {
            CollectionDef def = defs.get(e.getKey());
            if (def == null) {
                ConsoleLog.debug("Collections", "Ignoring saved state for unknown collection=" + e.getKey());
                continue;
            }
            CollectionState st = states.get(def.id);
            SaveData.CollectionRecord r = e.getValue();

            for (Map.Entry<String, SaveData.ItemRecord> ie : r.items().entrySet()) {
                if (def.item(ie.getKey()) == null) {
                    ConsoleLog.debug("Collections", "Ignoring saved item=" + ie.getKey() + " not in collection=" + def.id);
                    continue;
                }
                SaveData.ItemRecord ir = ie.getValue();
                if (!ir.collected()) continue;
                st.collectedAt.put(ie.getKey(), ir.collectedAtMillis() != null ? ir.collectedAtMillis() : 0L);
            }

            // older saves only carry "completed"
            st.rewardGranted = r.rewardGranted() || r.completed();
            st.grantPending = st.rewardGranted && r.grantPending();
            st.completed = st.collectedCount() == def.items.size();
        }
    }
}
