package org.gudu0.progression.persistence;

/**
 * Durably records the engine's current state. Called right after a lifecycle transition,
 * before any reward grant is attempted.
 */
@FunctionalInterface
public interface StatePersister {
    void persistNow();
}
