package org.gudu0.progression.persistence;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the save document in memory. Used by tests and by hosts that persist elsewhere.
 */
public class InMemorySaveSlot implements SaveSlot {
    private volatile String blob;
    private final AtomicInteger writes = new AtomicInteger();

    public InMemorySaveSlot() {}

    public InMemorySaveSlot(String initial) {
        this.blob = initial;
    }

    @Override
    public Optional<String> read() {
        return Optional.ofNullable(blob);
    }

    @Override
    public void write(String blob) {
        this.blob = blob;
        writes.incrementAndGet();
    }

    public String contents() {
        return blob;
    }

    public int writeCount() {
        return writes.get();
    }

    @Override
    public String describe() {
        return "memory";
    }
}
