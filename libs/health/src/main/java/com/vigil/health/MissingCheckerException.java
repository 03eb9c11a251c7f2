package com.vigil.health;

/**
 * Thrown when a check is registered without an executable {@link HealthCheck}.
 */
public class MissingCheckerException extends HealthCheckRegistrationException {

    public MissingCheckerException(String checkId) {
        super(checkId, "health check has no checker: '%s'".formatted(checkId));
    }
}
