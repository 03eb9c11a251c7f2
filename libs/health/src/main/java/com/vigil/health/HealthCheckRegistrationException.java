package com.vigil.health;

/**
 * Base class for errors that reject a health check registration. The check is not added.
 */
public class HealthCheckRegistrationException extends RuntimeException {

    private final String checkId;

    public HealthCheckRegistrationException(String checkId, String message) {
        super(message);
        this.checkId = checkId;
    }

    /** Id of the check whose registration was rejected. */
    public String checkId() {
        return checkId;
    }
}
