package com.vigil.health;

/**
 * Error attached to every non-GREEN {@link CheckResult}. The cause, if any, is the error the check
 * itself reported, or a {@link CheckTimeoutException} when the run timed out.
 */
public class CheckFailedException extends Exception {

    private final String checkId;
    private final HealthStatus status;

    public CheckFailedException(String checkId, HealthStatus status, Throwable cause) {
        super("health check failed: %s : %s".formatted(checkId, status), cause);
        this.checkId = checkId;
        this.status = status;
    }

    public String checkId() {
        return checkId;
    }

    public HealthStatus status() {
        return status;
    }

    /** Returns true if the run failed because it exceeded its timeout. */
    public boolean isTimeout() {
        return getCause() instanceof CheckTimeoutException;
    }
}
