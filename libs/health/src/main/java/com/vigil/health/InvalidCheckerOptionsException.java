package com.vigil.health;

import java.util.EnumSet;
import java.util.Set;

/**
 * Thrown when a check's options fall outside the engine-wide bounds. All violations found are
 * reported together.
 */
public class InvalidCheckerOptionsException extends HealthCheckRegistrationException {

    /** The individual bound that was violated. */
    public enum Violation {

        /** The run interval is below {@link HealthEngineOptions#minRunInterval()}. */
        RUN_INTERVAL_TOO_FREQUENT,

        /** The timeout is above {@link HealthEngineOptions#maxTimeout()}. */
        TIMEOUT_TOO_HIGH
    }

    private final CheckerOptions options;
    private final Set<Violation> violations;

    public InvalidCheckerOptionsException(String checkId, CheckerOptions options, Set<Violation> violations) {
        super(checkId, "invalid health checker options: '%s' : %s : %s".formatted(checkId, options, violations));
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("violations must not be empty");
        }
        this.options = options;
        this.violations = Set.copyOf(EnumSet.copyOf(violations));
    }

    /** The effective options that were rejected. */
    public CheckerOptions options() {
        return options;
    }

    public Set<Violation> violations() {
        return violations;
    }

    public boolean hasViolation(Violation violation) {
        return violations.contains(violation);
    }
}
