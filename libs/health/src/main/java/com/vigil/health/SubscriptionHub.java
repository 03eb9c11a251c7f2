package com.vigil.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-out of the three engine event streams to their subscribers.
 * <p>
 * Not thread-safe: confined to the coordinator thread.
 */
final class SubscriptionHub {

    static final String REGISTERED_CHECKS = "registered-checks";
    static final String CHECK_RESULTS = "check-results";
    static final String OVERALL_HEALTH = "overall-health";

    private static final Logger log = LoggerFactory.getLogger(SubscriptionHub.class);

    private final Set<Subscription<RegisteredCheck>> registeredChecks = new LinkedHashSet<>();
    private final Map<Subscription<CheckResult>, Predicate<CheckResult>> checkResults = new LinkedHashMap<>();
    private final Set<Subscription<HealthStatus>> overallHealth = new LinkedHashSet<>();

    void addRegisteredCheckSubscriber(Subscription<RegisteredCheck> subscription) {
        registeredChecks.add(subscription);
    }

    void addCheckResultSubscriber(Subscription<CheckResult> subscription, Predicate<CheckResult> filter) {
        checkResults.put(subscription, filter != null ? filter : result -> true);
    }

    /**
     * Adds an overall-health subscriber and hands it the current status as its first element.
     */
    void addOverallHealthSubscriber(Subscription<HealthStatus> subscription, HealthStatus current) {
        subscription.deliver(current);
        overallHealth.add(subscription);
    }

    void remove(Subscription<?> subscription) {
        registeredChecks.remove(subscription);
        checkResults.remove(subscription);
        overallHealth.remove(subscription);
    }

    void publishRegisteredCheck(RegisteredCheck check) {
        registeredChecks.removeIf(subscription -> !subscription.deliver(check));
    }

    void publishCheckResult(CheckResult result) {
        List<Subscription<CheckResult>> closed = new ArrayList<>();
        checkResults.forEach((subscription, filter) -> {
            if (accepts(filter, result) && !subscription.deliver(result)) {
                closed.add(subscription);
            }
        });
        closed.forEach(checkResults::remove);
    }

    void publishOverallHealth(HealthStatus status) {
        overallHealth.removeIf(subscription -> !subscription.deliver(status));
    }

    int size() {
        return registeredChecks.size() + checkResults.size() + overallHealth.size();
    }

    void closeAll() {
        registeredChecks.forEach(Subscription::markClosed);
        checkResults.keySet().forEach(Subscription::markClosed);
        overallHealth.forEach(Subscription::markClosed);
        registeredChecks.clear();
        checkResults.clear();
        overallHealth.clear();
    }

    private static boolean accepts(Predicate<CheckResult> filter, CheckResult result) {
        try {
            return filter.test(result);
        } catch (Throwable e) {
            log.warn("Check result filter failed for '{}', result not delivered", result.checkId(), e);
            return false;
        }
    }
}
