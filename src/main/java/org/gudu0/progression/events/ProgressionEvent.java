package org.gudu0.progression.events;

import java.util.Map;

/**
 * Something the engine reports to its collaborators. Delivery is fire-and-forget and
 * at-least-once, so consumers should de-duplicate on the ids an event carries.
 */
public interface ProgressionEvent {

    /** Analytics event name, e.g. {@code achievement_unlocked}. */
    String name();

    /** Flat attribute map for analytics. */
    Map<String, Object> attributes();
}
