package org.gudu0.progression.persistence;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable home of one save document.
 */
public interface SaveSlot {

    /** @return the stored document, or empty if nothing was saved yet */
    Optional<String> read() throws IOException;

    /** Replaces the stored document atomically. */
    void write(String blob) throws IOException;

    /** Human-readable location for logs. */
    String describe();
}
