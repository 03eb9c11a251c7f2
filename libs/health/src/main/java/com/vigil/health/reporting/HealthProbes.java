package com.vigil.health.reporting;

import com.vigil.health.CheckResult;
import com.vigil.health.HealthCheckRegistry;
import com.vigil.health.HealthStatus;
import com.vigil.health.RegisteredCheck;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liveness and readiness derived from the health engine.
 * <ul>
 *   <li>Alive: the overall health is not RED.</li>
 *   <li>Ready: {@link #runStartupChecks()} ran every registered check once and all were GREEN.</li>
 * </ul>
 */
public final class HealthProbes {

    private static final Logger log = LoggerFactory.getLogger(HealthProbes.class);

    private final HealthCheckRegistry registry;
    private final AtomicBoolean ready = new AtomicBoolean();

    public HealthProbes(HealthCheckRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    public boolean isAlive() {
        return registry.overallHealth() != HealthStatus.RED;
    }

    public boolean isReady() {
        return ready.get();
    }

    /**
     * Runs every registered check once, synchronously and in registration order, and marks the
     * service ready if all of them are GREEN.
     *
     * @return the results, in registration order
     * @throws StartupCheckException if any check is not GREEN; the service stays not ready
     */
    public List<CheckResult> runStartupChecks() {
        List<CheckResult> results = new ArrayList<>();
        List<CheckResult> failures = new ArrayList<>();
        for (RegisteredCheck check : registry.registeredChecks()) {
            CheckResult result = check.checker().check();
            results.add(result);
            if (!result.isGreen()) {
                failures.add(result);
            }
        }
        if (!failures.isEmpty()) {
            throw new StartupCheckException(failures);
        }
        ready.set(true);
        log.info("Startup health checks passed ({} checks), service is ready", results.size());
        return List.copyOf(results);
    }
}
