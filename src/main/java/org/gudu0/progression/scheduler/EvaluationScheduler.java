package org.gudu0.progression.scheduler;

import org.gudu0.progression.util.ConsoleLog;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides when the engine re-evaluates.
 * <ul>
 *   <li>{@link #onMutation()}: right after a counter change or item collection, same call.</li>
 *   <li>{@link #tick()}: safety sweep from a host game loop, at most once per interval.
 *       Mutations do not push the next sweep back.</li>
 *   <li>{@link #start()}: the same sweep on a background timer, for hosts without a loop.</li>
 * </ul>
 */
public class EvaluationScheduler {
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

    private final Runnable evaluation;
    private final Runnable sweep;
    private final Clock clock;
    private final Duration interval;

    private final AtomicLong lastSweepMillis;
    private final AtomicLong sweeps = new AtomicLong();

    private ScheduledExecutorService timer;

    /**
     * @param evaluation runs after every mutation
     * @param sweep      runs on the periodic safety sweep (typically evaluation plus housekeeping)
     */
    public EvaluationScheduler(Runnable evaluation, Runnable sweep, Clock clock, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            ConsoleLog.warn("Scheduler", "Invalid sweep interval " + interval + ", using " + DEFAULT_INTERVAL);
            interval = DEFAULT_INTERVAL;
        }
        this.evaluation = evaluation;
        this.sweep = sweep;
        this.clock = clock;
        this.interval = interval;
        this.lastSweepMillis = new AtomicLong(clock.millis());
    }

    /** Event-driven trigger. */
    public void onMutation() {
        run(evaluation);
    }

    /**
     * Cooperative trigger: runs a sweep if the interval has elapsed since the last sweep.
     *
     * @return true if a sweep ran
     */
    public boolean tick() {
        long now = clock.millis();
        if (now - lastSweepMillis.get() < interval.toMillis()) return false;

        sweepNow();
        return true;
    }

    /** Runs the safety sweep regardless of the interval. */
    public void sweepNow() {
        lastSweepMillis.set(clock.millis());
        long n = sweeps.incrementAndGet();
        ConsoleLog.debug("Scheduler", "Safety sweep #" + n);
        run(sweep);
    }

    private void run(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            ConsoleLog.error("Scheduler", "Evaluation failed: " + e.getMessage(), e);
        }
    }

    public synchronized void start() {
        if (timer != null) return;

        long period = interval.toMillis();
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "EvaluationScheduler");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleAtFixedRate(this::sweepNow, period, period, TimeUnit.MILLISECONDS);
        ConsoleLog.info("Scheduler", "Started safety sweep every " + interval.toSeconds() + "s");
    }

    public synchronized void stop() {
        if (timer == null) return;
        timer.shutdown();
        timer = null;
        ConsoleLog.info("Scheduler", "Stopped safety sweep");
    }

    public boolean isRunning() {
        return timer != null;
    }

    public long sweepCount() {
        return sweeps.get();
    }

    public Duration interval() {
        return interval;
    }
}
