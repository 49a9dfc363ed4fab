package org.gudu0.progression.engine;

import org.gudu0.progression.config.Catalog;
import org.gudu0.progression.config.EngineConfig;
import org.gudu0.progression.persistence.FileSaveSlot;
import org.gudu0.progression.persistence.SaveSlot;
import org.gudu0.progression.util.ConsoleLog;
import org.gudu0.progression.util.EnginePaths;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Lazily creates and caches one {@link ProgressionEngine} per save slot.
 * <p>
 * Each slot gets its own engine (and therefore its own lock, scheduler and save file
 * under data/slots/&lt;slot&gt;/progress.json).
 */
public final class EngineRegistry {

    private final EngineConfig cfg;
    private final Catalog catalog;
    private final Function<String, EngineCollaborators> collaborators;
    private final Function<String, SaveSlot> slotFactory;
    private final boolean background;

    private final ConcurrentHashMap<String, ProgressionEngine> engines = new ConcurrentHashMap<>();

    /** File-backed slots with background sweep and auto-flush. */
    public EngineRegistry(EngineConfig cfg, Catalog catalog, Function<String, EngineCollaborators> collaborators) {
        this(cfg, catalog, collaborators, slot -> new FileSaveSlot(EnginePaths.slotFile(slot)), true);
    }

    /**
     * @param collaborators builds the collaborators for a slot (called once per slot)
     */
    public EngineRegistry(EngineConfig cfg, Catalog catalog, Function<String, EngineCollaborators> collaborators,
                          Function<String, SaveSlot> slotFactory, boolean background) {
        this.cfg = cfg;
        this.catalog = catalog;
        this.collaborators = collaborators;
        this.slotFactory = slotFactory;
        this.background = background;
    }

    /**
     * Get or create the engine for a slot.
     *
     * @throws IllegalArgumentException if the slot name is not [A-Za-z0-9_-]{1,64}
     */
    public ProgressionEngine get(String slot) {
        if (!EnginePaths.isValidSlotName(slot)) {
            throw new IllegalArgumentException("Invalid save slot name: " + slot);
        }

        ProgressionEngine existing = engines.get(slot);
        if (existing != null) {
            ConsoleLog.debug("EngineRegistry", "Cache hit slot=" + slot);
            return existing;
        }

        return engines.computeIfAbsent(slot, s -> {
            ConsoleLog.info("EngineRegistry", "Cache miss slot=" + s + " (creating engine)");
            ProgressionEngine engine = ProgressionEngine.init(s, cfg, catalog, collaborators.apply(s), slotFactory.apply(s));
            if (background) engine.startBackground();
            return engine;
        });
    }

    public List<String> slots() {
        List<String> out = new ArrayList<>(engines.keySet());
        out.sort(String::compareTo);
        return out;
    }

    public int cachedCount() {
        return engines.size();
    }

    /** Shuts every engine down, flushing its save. */
    public void shutdownAll() {
        for (ProgressionEngine engine : engines.values()) {
            try {
                engine.shutdown();
            } catch (Exception e) {
                ConsoleLog.error("EngineRegistry", "Failed to shut down slot=" + engine.name() + ": " + e.getMessage(), e);
            }
        }
        engines.clear();
    }
}
