package org.gudu0.progression.persistence;

import org.gudu0.progression.util.ConsoleLog;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Writes engine snapshots to a {@link SaveSlot}.
 * <p>
 * Counter churn only marks the store dirty and is picked up by the periodic auto-flush;
 * lifecycle transitions call {@link #persistNow()} to write immediately.
 */
public class SaveSlotStore implements StatePersister {
    /** Guards writes; owners synchronize their own mutations on it too so snapshots never see half a change. */
    public final Object lock = new Object();

    private final SaveSlot slot;
    private final Supplier<String> snapshot;
    private final String nameForLogs;

    private ScheduledExecutorService scheduler;
    private volatile boolean dirty = false;

    /**
     * @param snapshot produces a consistent, already-encoded document of the current state
     */
    public SaveSlotStore(SaveSlot slot, Supplier<String> snapshot, String nameForLogs) {
        this.slot = slot;
        this.snapshot = snapshot;
        this.nameForLogs = nameForLogs;
    }

    /** Reads the stored document; IO failures are logged and treated as "no save". */
    public Optional<String> readBlob() {
        try {
            Optional<String> blob = slot.read();
            ConsoleLog.info("SaveSlotStore", "Loaded " + nameForLogs + " from " + slot.describe()
                    + (blob.isPresent() ? "" : " (empty)"));
            return blob;
        } catch (IOException e) {
            ConsoleLog.error("SaveSlotStore", "Failed to read " + nameForLogs + ", starting fresh: " + e.getMessage(), e);
            return Optional.empty();
        }
    }

    public void markDirty() {
        dirty = true;
    }

    public boolean isDirty() {
        return dirty;
    }

    @Override
    public void persistNow() {
        dirty = true;
        tryFlush();
    }

    public synchronized void startAutoFlush(long periodSeconds) {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "SaveSlotStore-" + nameForLogs);
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tryFlush, periodSeconds, periodSeconds, TimeUnit.SECONDS);
        ConsoleLog.debug("SaveSlotStore", "Auto-flush every " + periodSeconds + "s for " + nameForLogs);
    }

    public void tryFlush() {
        if (!dirty) return;
        try {
            flushNow();
        } catch (Exception e) {
            ConsoleLog.error("SaveSlotStore", nameForLogs + " flush failed: " + e.getMessage(), e);
        }
    }

    public void flushNow() throws IOException {
        synchronized (lock) {
            if (!dirty) return;

            ConsoleLog.debug("SaveSlotStore", "Flushing " + nameForLogs + " -> " + slot.describe());

            // cleared before the snapshot so a concurrent mutation re-dirties the store
            dirty = false;
            try {
                slot.write(snapshot.get());
            } catch (IOException | RuntimeException e) {
                dirty = true;
                throw e;
            }

            ConsoleLog.debug("SaveSlotStore", "Flushed " + nameForLogs);
        }
    }

    /** Stops auto-flush and writes any pending changes. */
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
        tryFlush();
    }
}
