package org.gudu0.progression.engine;

import org.gudu0.progression.achievements.AchievementRegistry;
import org.gudu0.progression.achievements.AchievementView;
import org.gudu0.progression.collections.CollectionAggregator;
import org.gudu0.progression.collections.CollectionView;
import org.gudu0.progression.config.Catalog;
import org.gudu0.progression.config.EngineConfig;
import org.gudu0.progression.counters.CounterStore;
import org.gudu0.progression.events.EventDispatcher;
import org.gudu0.progression.persistence.ProgressionCodec;
import org.gudu0.progression.persistence.SaveData;
import org.gudu0.progression.persistence.SaveSlot;
import org.gudu0.progression.persistence.SaveSlotStore;
import org.gudu0.progression.scheduler.EvaluationScheduler;
import org.gudu0.progression.util.ConsoleLog;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * One player's progression for one save slot: counters, achievements and collections.
 * <p>
 * Every mutation runs under a single lock shared with the save store, so the
 * "already unlocked / claimed / completed?" checks and the one-time reward grants are
 * atomic, and a save never observes half a mutation. No public method throws: failures
 * are logged and the call degrades to a no-op.
 * <p>
 * Callers should treat counters as non-decreasing. Lowering a counter with
 * {@link #setProgress(String, long)} never re-locks an achievement, but the progress shown
 * for locked achievements drops with it.
 */
public final class ProgressionEngine {
    private final String name;
    private final Object lock;
    private final Clock clock;
    private final EngineConfig cfg;

    private final CounterStore counters = new CounterStore();
    private final AchievementRegistry achievements;
    private final CollectionAggregator collections;

    private final ProgressionCodec codec = new ProgressionCodec();
    private final SaveSlotStore store;
    private final EvaluationScheduler scheduler;

    private volatile boolean shutdown = false;

    private ProgressionEngine(String name, EngineConfig cfg, Catalog catalog,
                              EngineCollaborators collaborators, SaveSlot slot, Clock clock) {
        this.name = name;
        this.cfg = cfg;
        this.clock = clock;

        this.store = new SaveSlotStore(slot, this::encodeState, name);
        this.lock = store.lock;

        EventDispatcher events = new EventDispatcher(collaborators.notifications(), collaborators.analytics());
        this.achievements = new AchievementRegistry(catalog.achievements(), events, collaborators.rewards(), store, clock);
        this.collections = new CollectionAggregator(catalog.collections(), counters, events, collaborators.rewards(), store, clock);

        this.scheduler = new EvaluationScheduler(this::evaluateAll, this::sweep, clock,
                Duration.ofSeconds(cfg.sweepIntervalSeconds));
    }

    public static ProgressionEngine init(String name, EngineConfig cfg, Catalog catalog,
                                         EngineCollaborators collaborators, SaveSlot slot) {
        return init(name, cfg, catalog, collaborators, slot, Clock.systemUTC());
    }

    /**
     * Builds an engine, restores the slot's saved state, retries grants a previous run left
     * pending, and runs one evaluation pass.
     *
     * @throws org.gudu0.progression.config.ConfigurationException if the catalog is malformed
     */
    public static ProgressionEngine init(String name, EngineConfig cfg, Catalog catalog,
                                         EngineCollaborators collaborators, SaveSlot slot, Clock clock) {
        ProgressionEngine engine = new ProgressionEngine(name, cfg, catalog, collaborators, slot, clock);
        engine.restore(engine.store.readBlob().orElse(null));
        ConsoleLog.info("Engine", "Engine ready slot=" + name
                + " achievements=" + catalog.achievements().size()
                + " collections=" + catalog.collections().size());
        return engine;
    }

    public String name() {
        return name;
    }

    /** Starts the background safety sweep and periodic auto-flush. */
    public void startBackground() {
        scheduler.start();
        store.startAutoFlush(cfg.autoFlushSeconds);
    }

    /** Stops background work and flushes pending changes. Later calls become no-ops. */
    public void shutdown() {
        if (shutdown) return;
        scheduler.stop();
        synchronized (lock) {
            shutdown = true;
        }
        store.close();
        ConsoleLog.info("Engine", "Engine shut down slot=" + name);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    // ----------------------------
    // Host operations
    // ----------------------------

    /** Adds {@code delta} (>= 0) to a counter. @return the counter's new value */
    public long reportProgress(String key, long delta) {
        return guarded("reportProgress", () -> {
            synchronized (lock) {
                if (rejectIfShutdown("reportProgress")) return counters.get(key);

                long before = counters.get(key);
                long after = counters.increment(key, delta);
                if (after != before) {
                    store.markDirty();
                    scheduler.onMutation();
                }
                return after;
            }
        }, 0L);
    }

    /** Sets a counter to an absolute value (>= 0). @return the previous value */
    public long setProgress(String key, long value) {
        return guarded("setProgress", () -> {
            synchronized (lock) {
                if (rejectIfShutdown("setProgress")) return counters.get(key);

                long old = counters.set(key, value);
                if (counters.get(key) != old) {
                    store.markDirty();
                    scheduler.onMutation();
                }
                return old;
            }
        }, 0L);
    }

    public long getProgress(String key) {
        return guarded("getProgress", () -> {
            synchronized (lock) {
                return counters.get(key);
            }
        }, 0L);
    }

    public Map<String, Long> getCounters() {
        return guarded("getCounters", () -> {
            synchronized (lock) {
                return counters.snapshot().asMap();
            }
        }, Map.of());
    }

    /** @return true if the item was newly collected */
    public boolean collectItem(String collectionId, String itemId) {
        return guarded("collectItem", () -> {
            synchronized (lock) {
                if (rejectIfShutdown("collectItem")) return false;

                boolean collected = collections.collect(collectionId, itemId);
                if (collected) scheduler.onMutation();
                return collected;
            }
        }, false);
    }

    /** @return true if this call claimed the achievement (and granted its rewards) */
    public boolean claimAchievement(String id) {
        return guarded("claimAchievement", () -> {
            synchronized (lock) {
                if (rejectIfShutdown("claimAchievement")) return false;
                return achievements.claim(id);
            }
        }, false);
    }

    public List<AchievementView> getAchievements() {
        return guarded("getAchievements", () -> {
            synchronized (lock) {
                return List.copyOf(achievements.views());
            }
        }, List.of());
    }

    public List<AchievementView> listUnlocked() {
        return guarded("listUnlocked", () -> {
            synchronized (lock) {
                return List.copyOf(achievements.listUnlocked());
            }
        }, List.of());
    }

    public List<AchievementView> listClaimable() {
        return guarded("listClaimable", () -> {
            synchronized (lock) {
                return List.copyOf(achievements.listClaimable());
            }
        }, List.of());
    }

    public List<CollectionView> getCollections() {
        return guarded("getCollections", () -> {
            synchronized (lock) {
                return List.copyOf(collections.views());
            }
        }, List.of());
    }

    // ----------------------------
    // Evaluation
    // ----------------------------

    /** Re-checks every locked achievement and every incomplete collection. */
    public void evaluateAll() {
        guarded("evaluateAll", () -> {
            synchronized (lock) {
                if (shutdown) return null;
                achievements.evaluate(counters.snapshot());
                collections.evaluate();
            }
            return null;
        }, null);
    }

    /** Cooperative host-loop hook; runs the safety sweep when its interval has elapsed. */
    public boolean tick() {
        return guarded("tick", scheduler::tick, false);
    }

    public EvaluationScheduler scheduler() {
        return scheduler;
    }

    private void sweep() {
        synchronized (lock) {
            if (shutdown) return;
            evaluateAll();
            achievements.retryPendingGrants();
            collections.retryPendingGrants();
        }
    }

    // ----------------------------
    // Persistence
    // ----------------------------

    /** @return a consistent JSON snapshot of all mutable state */
    public String save() {
        return guarded("save", this::encodeState, "");
    }

    /** Writes the current state to the save slot right away. */
    public void flush() {
        guarded("flush", () -> {
            store.persistNow();
            return null;
        }, null);
    }

    /**
     * Replaces all mutable state with the contents of {@code blob}. Corrupt entries are
     * dropped; an unreadable document resets to a fresh state.
     */
    public void load(String blob) {
        guarded("load", () -> {
            if (rejectIfShutdown("load")) return null;
            restore(blob);
            store.persistNow();
            return null;
        }, null);
    }

    private void restore(String blob) {
        synchronized (lock) {
            SaveData data = codec.decode(blob);
            counters.restore(data.counters);
            achievements.restore(data.achievements);
            collections.restore(data.collections);

            // pending grants are retried without replaying the unlock / completion events
            int retried = achievements.retryPendingGrants() + collections.retryPendingGrants();
            if (retried > 0) {
                ConsoleLog.info("Engine", "Completed " + retried + " pending reward grant(s) on load slot=" + name);
            }

            evaluateAll();
        }
    }

    private String encodeState() {
        synchronized (lock) {
            return codec.encode(new SaveData(
                    counters.snapshot().asMap(),
                    achievements.toRecords(),
                    collections.toRecords(),
                    clock.millis()
            ));
        }
    }

    // ----------------------------
    // Utils
    // ----------------------------

    private boolean rejectIfShutdown(String op) {
        if (!shutdown) return false;
        ConsoleLog.warn("Engine", op + " ignored, engine for slot=" + name + " is shut down");
        return true;
    }

    private static <T> T guarded(String op, Supplier<T> body, T fallback) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            ConsoleLog.error("Engine", op + " failed: " + e.getMessage(), e);
            return fallback;
        }
    }
}
