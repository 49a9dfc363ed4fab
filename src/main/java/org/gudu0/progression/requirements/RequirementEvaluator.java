package org.gudu0.progression.requirements;

import org.gudu0.progression.counters.CounterSnapshot;

/**
 * Pure evaluation of a {@link RequirementSet} against a {@link CounterSnapshot}.
 */
public final class RequirementEvaluator {
    private RequirementEvaluator() {}

    public static Evaluation evaluate(RequirementSet set, CounterSnapshot counters) {
        boolean satisfied = true;
        long progress = 0;

        for (Requirement r : set) {
            long current = counters.get(r.key());
            if (current < r.threshold()) satisfied = false;
            progress = RequirementSet.saturatingAdd(progress, Math.min(current, r.threshold()));
        }

        return new Evaluation(satisfied, progress, set.target());
    }

    /**
     * @param satisfied every requirement met
     * @param progress  sum of min(current, threshold)
     * @param target    sum of thresholds
     */
    public record Evaluation(boolean satisfied, long progress, long target) {}
}
