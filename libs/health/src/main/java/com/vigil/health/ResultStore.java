package com.vigil.health;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Latest result per check, plus the overall health derived from them.
 * <p>
 * Not thread-safe: confined to the coordinator thread.
 */
final class ResultStore {

    private final Map<String, CheckResult> latest = new LinkedHashMap<>();
    private HealthStatus overallHealth = HealthStatus.GREEN;

    /**
     * Reduces results to one status: RED if any is RED, else YELLOW if any is YELLOW, else GREEN.
     */
    static HealthStatus aggregate(Collection<CheckResult> results) {
        HealthStatus status = HealthStatus.GREEN;
        for (CheckResult result : results) {
            if (result.status() == HealthStatus.RED) {
                return HealthStatus.RED;
            }
            status = HealthStatus.worst(status, result.status());
        }
        return status;
    }

    /**
     * Stores the result, replacing the previous one for the same check, and recomputes the
     * overall health.
     *
     * @return true if the overall health changed
     */
    boolean record(CheckResult result) {
        latest.put(result.checkId(), result);
        HealthStatus previous = overallHealth;
        overallHealth = aggregate(latest.values());
        return previous != overallHealth;
    }

    HealthStatus overallHealth() {
        return overallHealth;
    }

    List<CheckResult> snapshot(Predicate<CheckResult> filter) {
        if (filter == null) {
            return List.copyOf(latest.values());
        }
        List<CheckResult> matching = new ArrayList<>();
        for (CheckResult result : latest.values()) {
            if (filter.test(result)) {
                matching.add(result);
            }
        }
        return List.copyOf(matching);
    }

    int size() {
        return latest.size();
    }
}
