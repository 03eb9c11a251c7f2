package com.vigil.health;

/**
 * What a raw {@link HealthCheck} reports for a single run.
 *
 * @param status health status determined by the check
 * @param cause  optional error explaining a YELLOW or RED status (ignored when GREEN)
 */
public record CheckOutcome(HealthStatus status, Throwable cause) {

    private static final CheckOutcome GREEN = new CheckOutcome(HealthStatus.GREEN, null);

    public CheckOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    /** Creates a GREEN outcome. */
    public static CheckOutcome green() {
        return GREEN;
    }

    /** Creates a YELLOW outcome. */
    public static CheckOutcome yellow(Throwable cause) {
        return new CheckOutcome(HealthStatus.YELLOW, cause);
    }

    /** Creates a YELLOW outcome with a message describing the degradation. */
    public static CheckOutcome yellow(String message) {
        return yellow(new IllegalStateException(message));
    }

    /** Creates a RED outcome. */
    public static CheckOutcome red(Throwable cause) {
        return new CheckOutcome(HealthStatus.RED, cause);
    }

    /** Creates a RED outcome with a message describing the failure. */
    public static CheckOutcome red(String message) {
        return red(new IllegalStateException(message));
    }
}
