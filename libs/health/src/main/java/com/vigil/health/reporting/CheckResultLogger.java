package com.vigil.health.reporting;

import com.vigil.health.CheckResult;
import com.vigil.health.HealthCheckRegistry;
import com.vigil.health.RegisteredCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Logs health check registrations and results.
 * <p>
 * Registrations are logged at INFO. Results are logged by status: GREEN at DEBUG, YELLOW at WARN
 * and RED at ERROR with the result's error. The check id is put in the SLF4J MDC under
 * {@value #MDC_CHECK_ID} for the duration of each log statement.
 */
public final class CheckResultLogger implements AutoCloseable {

    /** MDC key holding the id of the check being logged. */
    public static final String MDC_CHECK_ID = "checkId";

    private final Logger log;
    private final HealthCheckRegistry registry;
    private SubscriptionPump<RegisteredCheck> registrations;
    private SubscriptionPump<CheckResult> results;

    public CheckResultLogger(HealthCheckRegistry registry) {
        this(registry, LoggerFactory.getLogger(CheckResultLogger.class));
    }

    CheckResultLogger(HealthCheckRegistry registry, Logger log) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
        this.log = log;
    }

    /**
     * Subscribes to the registry and starts logging. Checks registered before this call are not
     * logged as registrations.
     */
    public synchronized CheckResultLogger start() {
        if (results != null) {
            throw new IllegalStateException("logger already started");
        }
        registrations = new SubscriptionPump<>(
                "vigil-health-log-registrations", registry.subscribeForRegisteredChecks(), this::logRegistration)
                .start();
        results = new SubscriptionPump<>(
                "vigil-health-log-results", registry.subscribeForCheckResults(), this::logResult)
                .start();
        return this;
    }

    @Override
    public synchronized void close() {
        if (registrations != null) {
            registrations.close();
        }
        if (results != null) {
            results.close();
        }
    }

    void logRegistration(RegisteredCheck registered) {
        MDC.put(MDC_CHECK_ID, registered.id());
        try {
            log.info("Health check registered: id={}, description=\"{}\", redImpact=\"{}\", yellowImpact=\"{}\", timeout={}, runInterval={}",
                    registered.id(),
                    registered.check().description(),
                    registered.check().redImpact(),
                    registered.check().yellowImpact() != null ? registered.check().yellowImpact() : "",
                    registered.options().timeout(),
                    registered.options().runInterval());
        } finally {
            MDC.remove(MDC_CHECK_ID);
        }
    }

    void logResult(CheckResult result) {
        MDC.put(MDC_CHECK_ID, result.checkId());
        try {
            switch (result.status()) {
                case GREEN -> log.debug("Health check is GREEN: {}", result);
                case YELLOW -> log.warn("Health check is YELLOW: {} : {}", result, result.error().getMessage(), result.error());
                case RED -> log.error("Health check is RED: {} : {}", result, result.error().getMessage(), result.error());
            }
        } finally {
            MDC.remove(MDC_CHECK_ID);
        }
    }
}
