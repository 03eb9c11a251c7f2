package com.vigil.health;

/**
 * Thrown by {@link HealthCheckRegistry} operations invoked after, or interrupted by, shutdown.
 */
public class HealthEngineShutdownException extends IllegalStateException {

    public HealthEngineShutdownException() {
        super("health engine is shut down");
    }
}
