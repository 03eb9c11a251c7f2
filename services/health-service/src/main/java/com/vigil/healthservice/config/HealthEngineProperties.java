package com.vigil.healthservice.config;

import com.vigil.health.HealthEngineOptions;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the health engine.
 *
 * <p>Properties are bound from the {@code vigil.health.*} prefix:
 *
 * <pre>
 * vigil:
 *   health:
 *     service-name: payments-api
 *     max-check-parallelism: 2
 *     default-timeout: 5s
 *     default-run-interval: 15s
 *     min-run-interval: 1s
 *     max-timeout: 10s
 * </pre>
 *
 * @param serviceName Service name used as the {@code service} tag on health metrics. Required.
 * @param maxCheckParallelism Maximum number of scheduled checks running at once (default 1).
 * @param defaultTimeout Timeout for checks registered without one (default 5s).
 * @param defaultRunInterval Run interval for checks registered without one (default 15s).
 * @param minRunInterval Smallest run interval a check may request (default 1s).
 * @param maxTimeout Largest timeout a check may request (default 10s).
 */
@ConfigurationProperties(prefix = "vigil.health")
@Validated
public record HealthEngineProperties(
        @NotBlank String serviceName,
        int maxCheckParallelism,
        Duration defaultTimeout,
        Duration defaultRunInterval,
        Duration minRunInterval,
        Duration maxTimeout) {

    /**
     * Compact constructor: applies the engine defaults to unset fields. Runs before Bean
     * Validation, so defaults satisfy constraints.
     */
    public HealthEngineProperties {
        if (maxCheckParallelism <= 0) {
            maxCheckParallelism = HealthEngineOptions.DEFAULT_MAX_CHECK_PARALLELISM;
        }
        if (defaultTimeout == null) {
            defaultTimeout = HealthEngineOptions.DEFAULT_TIMEOUT;
        }
        if (defaultRunInterval == null) {
            defaultRunInterval = HealthEngineOptions.DEFAULT_RUN_INTERVAL;
        }
        if (minRunInterval == null) {
            minRunInterval = HealthEngineOptions.DEFAULT_MIN_RUN_INTERVAL;
        }
        if (maxTimeout == null) {
            maxTimeout = HealthEngineOptions.DEFAULT_MAX_TIMEOUT;
        }
    }

    /**
     * Converts to engine options.
     *
     * @throws IllegalArgumentException if the values are inconsistent, e.g. a default timeout
     *     above the maximum timeout
     */
    public HealthEngineOptions toOptions() {
        return HealthEngineOptions.builder()
                .maxCheckParallelism(maxCheckParallelism)
                .defaultTimeout(defaultTimeout)
                .defaultRunInterval(defaultRunInterval)
                .minRunInterval(minRunInterval)
                .maxTimeout(maxTimeout)
                .build();
    }
}
