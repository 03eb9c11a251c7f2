package com.vigil.health;

/**
 * Functional interface for the business logic of a single health check.
 * <p>
 * Implementations perform a lightweight probe of a dependency (database, cache, message broker)
 * and report a {@link CheckOutcome}. The engine runs them on its own threads and enforces the
 * registered timeout, so implementations may block. A thrown exception is reported as
 * {@link HealthStatus#RED} with the exception as cause.
 * <p>
 * Example usage:
 * <pre>{@code
 * HealthCheck postgresCheck = () -> {
 *     try (Connection connection = dataSource.getConnection()) {
 *         return connection.isValid(2)
 *                 ? CheckOutcome.green()
 *                 : CheckOutcome.red("connection is not valid");
 *     }
 * };
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Performs the health check.
     *
     * @return the outcome of this run
     * @throws Exception if the check could not be performed
     */
    CheckOutcome check() throws Exception;
}
