package org.gudu0.progression.requirements;

/**
 * A single threshold on a counter: met when {@code counter(key) >= threshold}.
 */
public record Requirement(String key, long threshold) {}
