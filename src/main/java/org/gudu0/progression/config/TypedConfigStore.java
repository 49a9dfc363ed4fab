package org.gudu0.progression.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.gudu0.progression.util.ConsoleLog;

import java.io.IOException;
import java.nio.file.*;
import java.util.function.Supplier;

/**
 * Loads and saves a Jackson-mapped config POJO with atomic writes.
 * Unknown fields are ignored so older builds can read newer files.
 */
public class TypedConfigStore<T> {
    private final Path path;
    private final ObjectMapper om;
    private final Class<T> type;
    private final Supplier<T> defaults;

    private boolean existed;
    private final T cfg;

    public TypedConfigStore(Path path, Class<T> type, Supplier<T> defaults) {
        this.path = path;
        this.type = type;
        this.defaults = defaults;
        this.om = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.cfg = loadOrNew();
    }

    public T cfg() { return cfg; }

    public synchronized void save() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        om.writeValue(tmp.toFile(), cfg);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        ConsoleLog.debug("TypedConfigStore", "Saved config to " + path);
    }

    /** Writes the current values if the file did not exist yet. */
    public void saveIfMissing() {
        if (existed) return;
        try {
            save();
            existed = true;
            ConsoleLog.warn("TypedConfigStore", "Config missing; wrote defaults to " + path);
        } catch (IOException e) {
            ConsoleLog.error("TypedConfigStore", "Failed to write default config to " + path + ": " + e.getMessage(), e);
        }
    }

    private T loadOrNew() {
        try {
            if (Files.exists(path)) {
                T loaded = om.readValue(path.toFile(), type);
                existed = true;
                ConsoleLog.info("TypedConfigStore", "Loaded config from " + path);
                return loaded;
            }
        } catch (Exception e) {
            ConsoleLog.error("TypedConfigStore", "Failed to load " + path + ", using defaults: " + e.getMessage(), e);
            return defaults.get();
        }
        ConsoleLog.warn("TypedConfigStore", "Config missing: " + path + " (will use defaults until saved)");
        return defaults.get();
    }
}
