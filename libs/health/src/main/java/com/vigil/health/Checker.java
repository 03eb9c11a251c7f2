package com.vigil.health;

/**
 * Executable form of a registered check, with timeout enforcement applied.
 * <p>
 * Invoking a checker runs the check synchronously and returns its result. The result is also
 * reported to the engine, so it shows up in snapshots and subscriptions like a scheduled run.
 */
@FunctionalInterface
public interface Checker {

    /**
     * Runs the check and returns its result. Never throws; failures are reported as a RED result.
     */
    CheckResult check();
}
