package com.vigil.health;

import java.time.Duration;

/**
 * A check run did not complete within its timeout.
 */
public class CheckTimeoutException extends Exception {

    private final String checkId;
    private final Duration timeout;

    public CheckTimeoutException(String checkId, Duration timeout) {
        super("health check timed out: %s after %s".formatted(checkId, timeout));
        this.checkId = checkId;
        this.timeout = timeout;
    }

    public String checkId() {
        return checkId;
    }

    public Duration timeout() {
        return timeout;
    }
}
