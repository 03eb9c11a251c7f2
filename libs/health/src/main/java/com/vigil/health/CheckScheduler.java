package com.vigil.health;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every registered check immediately and then again {@code runInterval} after each run
 * completes, until shutdown.
 * <p>
 * A single timer thread keeps the runs in time order and hands each due run to the worker pool.
 * A worker first takes a permit from the {@link ConcurrencyLimiter}, so at most
 * {@code maxCheckParallelism} scheduled checks execute at once, and returns it when the run ends.
 */
final class CheckScheduler {

    private static final Logger log = LoggerFactory.getLogger(CheckScheduler.class);

    private final ConcurrencyLimiter limiter;
    private final ScheduledExecutorService timer;
    private final ExecutorService workers;
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final Set<String> activeLoops = ConcurrentHashMap.newKeySet();

    CheckScheduler(ConcurrencyLimiter limiter) {
        this.limiter = limiter;
        this.timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("vigil-health-scheduler"));
        this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("vigil-health-run"));
    }

    /**
     * Starts the run loop for a newly registered check.
     */
    void schedule(RegisteredCheck check) {
        activeLoops.add(check.id());
        dispatch(check);
    }

    /** Number of checks whose run loop has not yet ended. */
    int activeLoops() {
        return activeLoops.size();
    }

    ConcurrencyLimiter limiter() {
        return limiter;
    }

    void shutdown() {
        if (stopped.compareAndSet(false, true)) {
            timer.shutdownNow();
            workers.shutdownNow();
            // runs still waiting on the timer were discarded along with it
            activeLoops.clear();
        }
    }

    boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        return timer.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS)
                && workers.awaitTermination(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
    }

    private void dispatch(RegisteredCheck check) {
        if (stopped.get()) {
            endLoop(check);
            return;
        }
        try {
            workers.execute(() -> runOnce(check));
        } catch (RejectedExecutionException e) {
            endLoop(check);
        }
    }

    private void runOnce(RegisteredCheck check) {
        try {
            limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            endLoop(check);
            return;
        }
        try {
            check.checker().check();
        } catch (RuntimeException e) {
            log.error("Unexpected failure running health check '{}'", check.id(), e);
        } finally {
            limiter.release();
        }
        scheduleNext(check);
    }

    private void scheduleNext(RegisteredCheck check) {
        if (stopped.get()) {
            endLoop(check);
            return;
        }
        try {
            timer.schedule(() -> dispatch(check), delayNanos(check.options().runInterval()), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            endLoop(check);
        }
    }

    /**
     * The run interval in nanoseconds, saturated at {@link Long#MAX_VALUE} for intervals too long
     * to express, which the timer treats as never due.
     */
    static long delayNanos(Duration runInterval) {
        try {
            return runInterval.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void endLoop(RegisteredCheck check) {
        if (activeLoops.remove(check.id())) {
            log.debug("Stopped scheduling health check '{}'", check.id());
        }
    }
}
