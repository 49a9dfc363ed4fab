package org.gudu0.progression.requirements;

import org.gudu0.progression.config.ConfigurationException;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Conjunctive set of requirements. Keys are unique, thresholds are non-negative,
 * and at least one requirement is present.
 */
public final class RequirementSet implements Iterable<Requirement> {
    private final List<Requirement> requirements;
    private final long target;

    private RequirementSet(List<Requirement> requirements) {
        this.requirements = List.copyOf(requirements);
        long t = 0;
        for (Requirement r : this.requirements) t = saturatingAdd(t, r.threshold());
        this.target = t;
    }

    /**
     * @throws ConfigurationException if the list is empty, a key is blank or repeated,
     *                                or a threshold is negative
     */
    public static RequirementSet of(List<Requirement> requirements) {
        if (requirements == null || requirements.isEmpty()) {
            throw new ConfigurationException("Requirement set must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (Requirement r : requirements) {
            if (r == null || r.key() == null || r.key().isBlank()) {
                throw new ConfigurationException("Requirement key must not be blank");
            }
            if (r.threshold() < 0) {
                throw new ConfigurationException("Requirement threshold must be >= 0 (key=" + r.key() + ")");
            }
            if (!seen.add(r.key())) {
                throw new ConfigurationException("Duplicate requirement key: " + r.key());
            }
        }
        return new RequirementSet(requirements);
    }

    public static RequirementSet of(Requirement... requirements) {
        return of(List.of(requirements));
    }

    public static RequirementSet single(String key, long threshold) {
        return of(new Requirement(key, threshold));
    }

    /** Sum of all thresholds; what a fully satisfied set reports as progress. */
    public long target() {
        return target;
    }

    public int size() {
        return requirements.size();
    }

    @Override
    public Iterator<Requirement> iterator() {
        return requirements.iterator();
    }

    static long saturatingAdd(long a, long b) {
        long r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) return Long.MAX_VALUE;
        return r;
    }
}
