package com.vigil.health;

/**
 * Health status for an individual check or the aggregate of all checks.
 * <p>
 * Constants are declared in severity order: {@code GREEN < YELLOW < RED}.
 */
public enum HealthStatus {

    /** The check passed. */
    GREEN,

    /** The check reports a degraded state; the service can still do its job. */
    YELLOW,

    /** The check failed; the service cannot do its job. */
    RED;

    /**
     * Returns true if this status is strictly more severe than {@code other}.
     */
    public boolean isWorseThan(HealthStatus other) {
        return compareTo(other) > 0;
    }

    /**
     * Returns the more severe of the two statuses.
     */
    public static HealthStatus worst(HealthStatus a, HealthStatus b) {
        return a.isWorseThan(b) ? a : b;
    }
}
