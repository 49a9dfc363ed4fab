package org.gudu0.progression.requirements;

import org.gudu0.progression.config.ConfigurationException;
import org.gudu0.progression.counters.CounterSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class RequirementEvaluatorTest {

    @Test
    void testSingleRequirementUnlocksAtThreshold() {
        RequirementSet set = RequirementSet.single("levels_completed", 100);

        RequirementEvaluator.Evaluation below = RequirementEvaluator.evaluate(set, CounterSnapshot.of(Map.of("levels_completed", 99L)));
        RequirementEvaluator.Evaluation at = RequirementEvaluator.evaluate(set, CounterSnapshot.of(Map.of("levels_completed", 100L)));

        assertFalse(below.satisfied());
        assertEquals(99, below.progress());
        assertTrue(at.satisfied());
        assertEquals(100, at.progress());
        assertEquals(100, at.target());
    }

    @Test
    void testAllRequirementsMustHold() {
        RequirementSet set = RequirementSet.of(
                new Requirement("levels_completed", 10),
                new Requirement("three_star_levels", 5));

        RequirementEvaluator.Evaluation ev = RequirementEvaluator.evaluate(set,
                CounterSnapshot.of(Map.of("levels_completed", 50L, "three_star_levels", 2L)));

        assertFalse(ev.satisfied());
        // overshoot on one key does not count toward the other
        assertEquals(12, ev.progress());
        assertEquals(15, ev.target());
    }

    @Test
    void testProgressIsCappedAtTarget() {
        RequirementSet set = RequirementSet.single("matches_made", 1000);

        RequirementEvaluator.Evaluation ev = RequirementEvaluator.evaluate(set,
                CounterSnapshot.of(Map.of("matches_made", 5000L)));

        assertTrue(ev.satisfied());
        assertEquals(1000, ev.progress());
    }

    @Test
    void testZeroThresholdIsSatisfiedByEmptyCounters() {
        RequirementSet set = RequirementSet.single("anything", 0);
        assertTrue(RequirementEvaluator.evaluate(set, CounterSnapshot.empty()).satisfied());
    }

    @Test
    void testResultDoesNotDependOnRequirementOrder() {
        Random random = new Random(42);
        Map<String, Long> counters = Map.of("a", 3L, "b", 7L, "c", 0L, "d", 12L);
        CounterSnapshot snapshot = CounterSnapshot.of(counters);

        List<Requirement> base = new ArrayList<>(List.of(
                new Requirement("a", 5),
                new Requirement("b", 7),
                new Requirement("c", 1),
                new Requirement("d", 10)));
        RequirementEvaluator.Evaluation expected = RequirementEvaluator.evaluate(RequirementSet.of(base), snapshot);

        for (int i = 0; i < 50; i++) {
            List<Requirement> shuffled = new ArrayList<>(base);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, RequirementEvaluator.evaluate(RequirementSet.of(shuffled), snapshot));
        }
    }

    @Test
    void testEvaluationIsPure() {
        RequirementSet set = RequirementSet.single("levels_completed", 3);
        CounterSnapshot snapshot = CounterSnapshot.of(Map.of("levels_completed", 2L));

        RequirementEvaluator.Evaluation first = RequirementEvaluator.evaluate(set, snapshot);
        RequirementEvaluator.Evaluation second = RequirementEvaluator.evaluate(set, snapshot);

        assertEquals(first, second);
        assertEquals(2, snapshot.get("levels_completed"));
    }

    @Test
    void testMalformedSetsAreRejected() {
        assertThrows(ConfigurationException.class, () -> RequirementSet.of(List.of()));
        assertThrows(ConfigurationException.class, () -> RequirementSet.single(" ", 1));
        assertThrows(ConfigurationException.class, () -> RequirementSet.single("a", -1));
        assertThrows(ConfigurationException.class, () -> RequirementSet.of(
                new Requirement("a", 1), new Requirement("a", 2)));
    }

    @Test
    void testTargetSaturates() {
        RequirementSet set = RequirementSet.of(
                new Requirement("a", Long.MAX_VALUE),
                new Requirement("b", 5));
        assertEquals(Long.MAX_VALUE, set.target());
    }
}
