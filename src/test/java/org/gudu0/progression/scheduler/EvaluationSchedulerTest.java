package org.gudu0.progression.scheduler;

import org.gudu0.progression.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluationSchedulerTest {

    private MutableClock clock;
    private AtomicInteger evaluations;
    private AtomicInteger sweeps;
    private EvaluationScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0L);
        evaluations = new AtomicInteger();
        sweeps = new AtomicInteger();
        scheduler = new EvaluationScheduler(evaluations::incrementAndGet, sweeps::incrementAndGet, clock, Duration.ofSeconds(5));
    }

    @Test
    void testMutationEvaluatesImmediately() {
        scheduler.onMutation();
        scheduler.onMutation();

        assertEquals(2, evaluations.get());
        assertEquals(0, sweeps.get());
    }

    @Test
    void testTickWaitsForInterval() {
        assertFalse(scheduler.tick());

        clock.advance(Duration.ofMillis(4_999));
        assertFalse(scheduler.tick());

        clock.advance(Duration.ofMillis(1));
        assertTrue(scheduler.tick());
        assertFalse(scheduler.tick());

        assertEquals(1, sweeps.get());
        assertEquals(1, scheduler.sweepCount());
    }

    @Test
    void testSteadyMutationsDoNotDelaySweep() {
        for (int second = 1; second <= 10; second++) {
            clock.advance(Duration.ofSeconds(1));
            scheduler.onMutation();
            boolean swept = scheduler.tick();

            assertEquals(second % 5 == 0, swept, "tick at " + second + "s");
        }

        assertEquals(10, evaluations.get());
        assertEquals(2, sweeps.get());
    }

    @Test
    void testSweepNowRestartsInterval() {
        clock.advance(Duration.ofSeconds(3));
        scheduler.sweepNow();

        clock.advance(Duration.ofSeconds(4));
        assertFalse(scheduler.tick());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(scheduler.tick());
        assertEquals(2, sweeps.get());
    }

    @Test
    void testSweepNowIgnoresInterval() {
        scheduler.sweepNow();
        scheduler.sweepNow();

        assertEquals(2, sweeps.get());
    }

    @Test
    void testFailingEvaluationIsContained() {
        EvaluationScheduler failing = new EvaluationScheduler(
                () -> { throw new IllegalStateException("boom"); },
                () -> { throw new IllegalStateException("boom"); },
                clock, Duration.ofSeconds(1));

        assertDoesNotThrow(failing::onMutation);
        clock.advance(Duration.ofSeconds(1));
        assertTrue(failing.tick());
    }

    @Test
    void testInvalidIntervalFallsBackToDefault() {
        EvaluationScheduler zero = new EvaluationScheduler(() -> {}, () -> {}, clock, Duration.ZERO);
        EvaluationScheduler none = new EvaluationScheduler(() -> {}, () -> {}, clock, null);

        assertEquals(EvaluationScheduler.DEFAULT_INTERVAL, zero.interval());
        assertEquals(EvaluationScheduler.DEFAULT_INTERVAL, none.interval());
    }

    @Test
    void testBackgroundTimerRunsSweeps() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);
        EvaluationScheduler timed = new EvaluationScheduler(() -> {}, latch::countDown,
                java.time.Clock.systemUTC(), Duration.ofMillis(20));

        timed.start();
        try {
            assertTrue(timed.isRunning());
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } finally {
            timed.stop();
        }
        assertFalse(timed.isRunning());
    }
}
