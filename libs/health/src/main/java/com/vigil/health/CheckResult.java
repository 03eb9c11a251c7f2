package com.vigil.health;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one execution of a {@link Checker}.
 *
 * @param checkId  id of the check that produced this result
 * @param status   health status of this run
 * @param error    why the run was not GREEN; null if and only if {@code status} is GREEN
 * @param time     when the run started
 * @param duration how long the run took
 */
public record CheckResult(
        String checkId,
        HealthStatus status,
        Throwable error,
        Instant time,
        Duration duration
) {

    public CheckResult {
        if (checkId == null || checkId.isBlank()) {
            throw new IllegalArgumentException("checkId must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (time == null) {
            throw new IllegalArgumentException("time must not be null");
        }
        if (duration == null) {
            throw new IllegalArgumentException("duration must not be null");
        }
        if (status == HealthStatus.GREEN && error != null) {
            throw new IllegalArgumentException("a GREEN result must not carry an error");
        }
        if (status != HealthStatus.GREEN && error == null) {
            throw new IllegalArgumentException("a " + status + " result must carry an error");
        }
    }

    /** Returns true if the run was GREEN. */
    public boolean isGreen() {
        return status == HealthStatus.GREEN;
    }

    @Override
    public String toString() {
        return "CheckResult{checkId=\"" + checkId + "\", status=" + status
                + ", time=" + time + ", duration=" + duration + "}";
    }
}
