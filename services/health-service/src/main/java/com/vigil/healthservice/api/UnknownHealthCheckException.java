package com.vigil.healthservice.api;

/**
 * Thrown when a request names a check id that is not registered.
 */
public class UnknownHealthCheckException extends RuntimeException {

    private final String checkId;

    public UnknownHealthCheckException(String checkId) {
        super("unknown health check: '%s'".formatted(checkId));
        this.checkId = checkId;
    }

    public String checkId() {
        return checkId;
    }
}
