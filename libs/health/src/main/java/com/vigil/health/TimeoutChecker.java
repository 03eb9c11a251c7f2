package com.vigil.health;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link Checker} that runs a raw {@link HealthCheck} on the check-runner executor and races it
 * against a timeout.
 * <p>
 * A run that misses its deadline is reported as RED with a {@link CheckTimeoutException} cause,
 * a start time of {@code now - timeout} and a duration equal to the timeout. The underlying check
 * is abandoned, not interrupted: it keeps its thread until it returns and its late outcome is
 * discarded.
 * <p>
 * Every result is passed to the result sink (the engine's intake) before being returned.
 */
final class TimeoutChecker implements Checker {

    private final String checkId;
    private final HealthCheck healthCheck;
    private final Duration timeout;
    private final Executor executor;
    private final Consumer<CheckResult> resultSink;

    TimeoutChecker(
            String checkId,
            HealthCheck healthCheck,
            Duration timeout,
            Executor executor,
            Consumer<CheckResult> resultSink) {
        this.checkId = checkId;
        this.healthCheck = healthCheck;
        this.timeout = timeout;
        this.executor = executor;
        this.resultSink = resultSink;
    }

    @Override
    public CheckResult check() {
        CheckResult result = runWithTimeout();
        resultSink.accept(result);
        return result;
    }

    Duration timeout() {
        return timeout;
    }

    private CheckResult runWithTimeout() {
        CompletableFuture<CheckResult> run;
        try {
            run = CompletableFuture.supplyAsync(this::runCheck, executor);
        } catch (RejectedExecutionException e) {
            return failure(HealthStatus.RED, e, Instant.now(), Duration.ZERO);
        }

        try {
            return run.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return failure(
                    HealthStatus.RED,
                    new CheckTimeoutException(checkId, timeout),
                    Instant.now().minus(timeout),
                    timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(HealthStatus.RED, e, Instant.now(), Duration.ZERO);
        } catch (ExecutionException e) {
            // runCheck only fails on an Error thrown by the check
            return failure(HealthStatus.RED, e.getCause(), Instant.now(), Duration.ZERO);
        }
    }

    private CheckResult runCheck() {
        Instant start = Instant.now();
        long startNanos = System.nanoTime();
        CheckOutcome outcome;
        try {
            outcome = healthCheck.check();
            if (outcome == null) {
                outcome = CheckOutcome.red(new IllegalStateException("health check returned no outcome"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = CheckOutcome.red(e);
        } catch (Exception e) {
            outcome = CheckOutcome.red(e);
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);

        if (outcome.status() == HealthStatus.GREEN) {
            return new CheckResult(checkId, HealthStatus.GREEN, null, start, duration);
        }
        return failure(outcome.status(), outcome.cause(), start, duration);
    }

    private CheckResult failure(HealthStatus status, Throwable cause, Instant start, Duration duration) {
        return new CheckResult(checkId, status, new CheckFailedException(checkId, status, cause), start, duration);
    }
}
