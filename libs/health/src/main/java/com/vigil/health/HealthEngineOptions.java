package com.vigil.health;

import java.time.Duration;

/**
 * Engine-wide configuration, fixed at construction time.
 *
 * @param maxCheckParallelism maximum number of scheduled checks that may run at the same time
 * @param defaultTimeout      timeout applied to checks registered without one
 * @param defaultRunInterval  run interval applied to checks registered without one
 * @param minRunInterval      smallest run interval a check may request
 * @param maxTimeout          largest timeout a check may request
 */
public record HealthEngineOptions(
        int maxCheckParallelism,
        Duration defaultTimeout,
        Duration defaultRunInterval,
        Duration minRunInterval,
        Duration maxTimeout
) {

    public static final int DEFAULT_MAX_CHECK_PARALLELISM = 1;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_RUN_INTERVAL = Duration.ofSeconds(15);
    public static final Duration DEFAULT_MIN_RUN_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_TIMEOUT = Duration.ofSeconds(10);

    public HealthEngineOptions {
        if (maxCheckParallelism < 1) {
            throw new IllegalArgumentException("maxCheckParallelism must be at least 1");
        }
        requirePositive(defaultTimeout, "defaultTimeout");
        requirePositive(defaultRunInterval, "defaultRunInterval");
        requirePositive(minRunInterval, "minRunInterval");
        requirePositive(maxTimeout, "maxTimeout");
        if (defaultTimeout.compareTo(maxTimeout) > 0) {
            throw new IllegalArgumentException("defaultTimeout must not exceed maxTimeout");
        }
        if (defaultRunInterval.compareTo(minRunInterval) < 0) {
            throw new IllegalArgumentException("defaultRunInterval must not be below minRunInterval");
        }
    }

    /**
     * Returns the default engine options.
     */
    public static HealthEngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder starting from the default values.
     */
    public static final class Builder {

        private int maxCheckParallelism = DEFAULT_MAX_CHECK_PARALLELISM;
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private Duration defaultRunInterval = DEFAULT_RUN_INTERVAL;
        private Duration minRunInterval = DEFAULT_MIN_RUN_INTERVAL;
        private Duration maxTimeout = DEFAULT_MAX_TIMEOUT;

        private Builder() {
        }

        public Builder maxCheckParallelism(int maxCheckParallelism) {
            this.maxCheckParallelism = maxCheckParallelism;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder defaultRunInterval(Duration defaultRunInterval) {
            this.defaultRunInterval = defaultRunInterval;
            return this;
        }

        public Builder minRunInterval(Duration minRunInterval) {
            this.minRunInterval = minRunInterval;
            return this;
        }

        public Builder maxTimeout(Duration maxTimeout) {
            this.maxTimeout = maxTimeout;
            return this;
        }

        public HealthEngineOptions build() {
            return new HealthEngineOptions(
                    maxCheckParallelism, defaultTimeout, defaultRunInterval, minRunInterval, maxTimeout);
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
