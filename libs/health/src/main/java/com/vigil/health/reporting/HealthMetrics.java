package com.vigil.health.reporting;

import com.vigil.health.CheckFailedException;
import com.vigil.health.CheckResult;
import com.vigil.health.HealthCheckRegistry;
import com.vigil.health.HealthStatus;
import com.vigil.health.RegisteredCheck;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publishes health engine state as Micrometer meters.
 * <p>
 * Every meter carries a {@code service} tag. Status gauges use the values 0 = GREEN, 1 = YELLOW,
 * 2 = RED and -1 = no result yet.
 * <ul>
 *   <li>{@value #CHECK_STATUS} (tag {@code check}): latest status of each registered check</li>
 *   <li>{@value #OVERALL_STATUS}: overall health</li>
 *   <li>{@value #CHECK_DURATION} (tags {@code check}, {@code status}): run durations</li>
 *   <li>{@value #CHECK_TIMEOUTS} (tag {@code check}): runs that exceeded their timeout</li>
 * </ul>
 */
public final class HealthMetrics implements AutoCloseable {

    public static final String CHECK_STATUS = "vigil.health.check.status";
    public static final String OVERALL_STATUS = "vigil.health.overall.status";
    public static final String CHECK_DURATION = "vigil.health.check.duration";
    public static final String CHECK_TIMEOUTS = "vigil.health.check.timeouts";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_CHECK = "check";
    public static final String TAG_STATUS = "status";

    static final int NO_RESULT = -1;

    private final HealthCheckRegistry registry;
    private final MeterRegistry meterRegistry;
    private final String serviceName;
    private final Map<String, AtomicInteger> checkStatus = new ConcurrentHashMap<>();
    private final AtomicInteger overallStatus = new AtomicInteger(NO_RESULT);
    private SubscriptionPump<RegisteredCheck> registrations;
    private SubscriptionPump<CheckResult> results;
    private SubscriptionPump<HealthStatus> overall;

    /**
     * @param registry      the health engine to observe
     * @param meterRegistry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName   logical service name included as a tag on every meter
     */
    public HealthMetrics(HealthCheckRegistry registry, MeterRegistry meterRegistry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (meterRegistry == null) {
            throw new IllegalArgumentException("meterRegistry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.meterRegistry = meterRegistry;
        this.serviceName = serviceName;
    }

    /**
     * Registers the overall gauge, a status gauge for every check already registered, and starts
     * following the engine's event streams.
     */
    public synchronized HealthMetrics start() {
        if (results != null) {
            throw new IllegalStateException("metrics already started");
        }
        Gauge.builder(OVERALL_STATUS, overallStatus, AtomicInteger::doubleValue)
                .description("Overall health: 0 = GREEN, 1 = YELLOW, 2 = RED")
                .tags(baseTags())
                .register(meterRegistry);

        // subscribe first so that no registration falls between the snapshot and the stream
        registrations = new SubscriptionPump<>(
                "vigil-health-metrics-registrations", registry.subscribeForRegisteredChecks(), this::onRegistered);
        results = new SubscriptionPump<>(
                "vigil-health-metrics-results", registry.subscribeForCheckResults(), this::onResult);
        overall = new SubscriptionPump<>(
                "vigil-health-metrics-overall", registry.subscribeForOverallHealthChanges(), this::onOverallHealth);
        registry.registeredChecks().forEach(this::onRegistered);

        registrations.start();
        results.start();
        overall.start();
        return this;
    }

    @Override
    public synchronized void close() {
        if (registrations != null) {
            registrations.close();
            results.close();
            overall.close();
        }
    }

    /** Returns the service name used as a default tag. */
    public String serviceName() {
        return serviceName;
    }

    void onRegistered(RegisteredCheck check) {
        checkStatus.computeIfAbsent(check.id(), id -> {
            AtomicInteger value = new AtomicInteger(NO_RESULT);
            Gauge.builder(CHECK_STATUS, value, AtomicInteger::doubleValue)
                    .description(check.check().description())
                    .tags(baseTags(TAG_CHECK, id))
                    .register(meterRegistry);
            return value;
        });
    }

    void onResult(CheckResult result) {
        AtomicInteger status = checkStatus.get(result.checkId());
        if (status != null) {
            status.set(gaugeValue(result.status()));
        }
        Timer.builder(CHECK_DURATION)
                .description("Health check run duration")
                .tags(baseTags(TAG_CHECK, result.checkId(), TAG_STATUS, result.status().name()))
                .register(meterRegistry)
                .record(result.duration());
        if (result.error() instanceof CheckFailedException failure && failure.isTimeout()) {
            Counter.builder(CHECK_TIMEOUTS)
                    .description("Health check runs that exceeded their timeout")
                    .tags(baseTags(TAG_CHECK, result.checkId()))
                    .register(meterRegistry)
                    .increment();
        }
    }

    void onOverallHealth(HealthStatus status) {
        overallStatus.set(gaugeValue(status));
    }

    static int gaugeValue(HealthStatus status) {
        return status.ordinal();
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
