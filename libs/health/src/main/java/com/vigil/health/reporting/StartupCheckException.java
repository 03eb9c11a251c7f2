package com.vigil.health.reporting;

import com.vigil.health.CheckResult;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when one or more health checks are not GREEN during startup.
 */
public class StartupCheckException extends RuntimeException {

    private final List<CheckResult> failures;

    public StartupCheckException(List<CheckResult> failures) {
        super("startup health checks failed: " + failures.stream()
                .map(result -> result.checkId() + "=" + result.status())
                .collect(Collectors.joining(", ")));
        this.failures = List.copyOf(failures);
        failures.forEach(result -> addSuppressed(result.error()));
    }

    /** The results that were not GREEN, in registration order. */
    public List<CheckResult> failures() {
        return failures;
    }
}
