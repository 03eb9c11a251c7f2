package com.vigil.healthservice.api;

import com.vigil.health.CheckResult;
import com.vigil.health.RegisteredCheck;

/**
 * A registered check joined with its latest result.
 *
 * @param id check id
 * @param description what the check verifies
 * @param yellowImpact impact when YELLOW, or null
 * @param redImpact impact when RED
 * @param timeoutMs effective timeout in milliseconds
 * @param runIntervalMs effective run interval in milliseconds
 * @param status latest status, or null if the check has not run yet
 * @param error message of the latest error, or null
 * @param lastRun start time of the latest run (ISO-8601), or null
 * @param durationMs duration of the latest run in milliseconds, or null
 */
public record CheckStatusResponse(
        String id,
        String description,
        String yellowImpact,
        String redImpact,
        long timeoutMs,
        long runIntervalMs,
        String status,
        String error,
        String lastRun,
        Long durationMs) {

    /**
     * @param check the registered check
     * @param result its latest result, or null if it has not run yet
     */
    public static CheckStatusResponse of(RegisteredCheck check, CheckResult result) {
        return new CheckStatusResponse(
                check.id(),
                check.check().description(),
                check.check().yellowImpact(),
                check.check().redImpact(),
                check.options().timeout().toMillis(),
                check.options().runInterval().toMillis(),
                result != null ? result.status().name() : null,
                result != null && result.error() != null ? describe(result.error()) : null,
                result != null ? result.time().toString() : null,
                result != null ? result.duration().toMillis() : null);
    }

    private static String describe(Throwable error) {
        Throwable cause = error.getCause();
        return cause != null ? error.getMessage() + ": " + cause.getMessage() : error.getMessage();
    }
}
