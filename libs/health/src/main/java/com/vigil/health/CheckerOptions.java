package com.vigil.health;

import java.time.Duration;

/**
 * Per-check run configuration.
 * <p>
 * A {@code null} or zero duration means "use the engine default" and is replaced at registration
 * time by {@link #withDefaults(HealthEngineOptions)}.
 *
 * @param timeout     how long a single run may take before it is reported as RED
 * @param runInterval delay between the end of one run and the start of the next
 */
public record CheckerOptions(Duration timeout, Duration runInterval) {

    /** Options that take every value from the engine defaults. */
    public static final CheckerOptions DEFAULTS = new CheckerOptions(Duration.ZERO, Duration.ZERO);

    public CheckerOptions {
        timeout = nonNegative(timeout, "timeout");
        runInterval = nonNegative(runInterval, "runInterval");
    }

    /** Options with an explicit timeout and the default run interval. */
    public static CheckerOptions withTimeout(Duration timeout) {
        return new CheckerOptions(timeout, Duration.ZERO);
    }

    /** Options with an explicit run interval and the default timeout. */
    public static CheckerOptions withRunInterval(Duration runInterval) {
        return new CheckerOptions(Duration.ZERO, runInterval);
    }

    /**
     * Replaces unset values with the engine-wide defaults.
     */
    public CheckerOptions withDefaults(HealthEngineOptions engineOptions) {
        return new CheckerOptions(
                timeout.isZero() ? engineOptions.defaultTimeout() : timeout,
                runInterval.isZero() ? engineOptions.defaultRunInterval() : runInterval);
    }

    private static Duration nonNegative(Duration value, String name) {
        if (value == null) {
            return Duration.ZERO;
        }
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }
}
