package com.vigil.healthservice.infrastructure.actuator;

import com.vigil.health.CheckResult;
import com.vigil.health.HealthCheckRegistry;
import com.vigil.health.HealthStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Contributes the engine's overall health to {@code /actuator/health} as {@code healthEngine}.
 *
 * <p>GREEN maps to UP, YELLOW to {@link #DEGRADED} and RED to DOWN. The latest status of each
 * check is included as a detail.
 */
@Component
public class HealthEngineHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "One or more health checks are YELLOW");

    private final HealthCheckRegistry registry;

    public HealthEngineHealthIndicator(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        HealthStatus overall = registry.overallHealth();
        Map<String, String> checks = new LinkedHashMap<>();
        for (CheckResult result : registry.checkResults()) {
            checks.put(result.checkId(), result.status().name());
        }
        return Health.status(toStatus(overall))
                .withDetail("overallHealth", overall.name())
                .withDetail("checks", checks)
                .build();
    }

    static Status toStatus(HealthStatus status) {
        return switch (status) {
            case GREEN -> Status.UP;
            case YELLOW -> DEGRADED;
            case RED -> Status.DOWN;
        };
    }
}
