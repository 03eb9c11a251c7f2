package com.vigil.health;

/**
 * Thrown when a check is registered with an id that is already registered.
 */
public class DuplicateCheckException extends HealthCheckRegistrationException {

    public DuplicateCheckException(String checkId) {
        super(checkId, "health check is already registered: '%s'".formatted(checkId));
    }
}
