package com.vigil.health;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Health engine: runs registered {@link HealthCheck}s on a schedule, keeps their latest results,
 * derives the overall {@link HealthStatus} and publishes registrations, results and overall-health
 * changes to subscribers.
 * <p>
 * All engine state is owned by a single coordinator thread that processes one command at a time
 * from its queue. Public operations post a command and, where they return something, block until
 * the coordinator has applied it, so a caller observes its own registration as soon as
 * {@link #register} returns. No locks guard the engine state.
 * <p>
 * Check executions are bounded by {@link HealthEngineOptions#maxCheckParallelism()} and guarded by
 * their timeout; their outcome never fails the engine, it only shows up as a {@link CheckResult}.
 * <p>
 * {@link #shutdown()} is one-way: scheduling stops, subscriptions are closed and further calls throw
 * {@link HealthEngineShutdownException}. Checks already executing are abandoned, not interrupted.
 * <p>
 * Example usage:
 * <pre>{@code
 * HealthCheckRegistry registry = new HealthCheckRegistry(HealthEngineOptions.defaults());
 * registry.register(
 *         Check.of("postgres", "database connectivity", "orders cannot be stored"),
 *         CheckerOptions.withRunInterval(Duration.ofSeconds(30)),
 *         postgresCheck);
 * HealthStatus overall = registry.overallHealth();
 * }</pre>
 */
public final class HealthCheckRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final HealthEngineOptions options;
    private final BlockingQueue<Runnable> commands = new LinkedBlockingQueue<>();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final Set<CompletableFuture<?>> pendingReplies = ConcurrentHashMap.newKeySet();
    private final ExecutorService checkRunner;
    private final CheckScheduler scheduler;
    private final Thread coordinator;

    // coordinator-confined state
    private final CheckTable checks = new CheckTable();
    private final ResultStore results = new ResultStore();
    private final SubscriptionHub subscriptions = new SubscriptionHub();

    /**
     * Creates and starts an engine with the default options.
     */
    public HealthCheckRegistry() {
        this(HealthEngineOptions.defaults());
    }

    /**
     * Creates and starts an engine.
     *
     * @param options engine-wide configuration
     */
    public HealthCheckRegistry(HealthEngineOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
        this.checkRunner = Executors.newCachedThreadPool(new DaemonThreadFactory("vigil-health-check"));
        this.scheduler = new CheckScheduler(new ConcurrencyLimiter(options.maxCheckParallelism()));
        this.coordinator = new Thread(this::runCoordinator, "vigil-health-coordinator");
        this.coordinator.setDaemon(true);
        this.coordinator.start();
        log.info("Health engine started: {}", options);
    }

    /**
     * Registers a check with the default options.
     *
     * @see #register(Check, CheckerOptions, HealthCheck)
     */
    public void register(Check check, HealthCheck healthCheck) {
        register(check, CheckerOptions.DEFAULTS, healthCheck);
    }

    /**
     * Registers a check and starts running it: once immediately, then every run interval.
     *
     * @param check       check identity and metadata
     * @param options     run options; unset values take the engine defaults
     * @param healthCheck the check logic
     * @throws MissingCheckerException        if {@code healthCheck} is null
     * @throws InvalidCheckerOptionsException if the options fall outside the engine bounds
     * @throws DuplicateCheckException        if a check with the same id is already registered
     * @throws HealthEngineShutdownException  if the engine is shut down
     */
    public void register(Check check, CheckerOptions options, HealthCheck healthCheck) {
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        CheckerOptions requested = options != null ? options : CheckerOptions.DEFAULTS;
        HealthCheckRegistrationException error = ask(() -> applyRegistration(check, requested, healthCheck));
        if (error != null) {
            throw error;
        }
    }

    /**
     * Returns the registered checks in registration order.
     */
    public List<RegisteredCheck> registeredChecks() {
        return ask(checks::snapshot);
    }

    /**
     * Returns the registered check with the given id, if any.
     */
    public Optional<RegisteredCheck> registeredCheck(String id) {
        return ask(() -> checks.find(id));
    }

    /**
     * Returns the latest result of every check that has run at least once.
     */
    public List<CheckResult> checkResults() {
        return checkResults(null);
    }

    /**
     * Returns the latest results accepted by {@code filter}; a null filter accepts all.
     */
    public List<CheckResult> checkResults(Predicate<CheckResult> filter) {
        return ask(() -> results.snapshot(filter));
    }

    /**
     * Returns the current overall health: RED if any latest result is RED, else YELLOW if any is
     * YELLOW, else GREEN. GREEN when no check has reported yet.
     */
    public HealthStatus overallHealth() {
        return ask(results::overallHealth);
    }

    /**
     * Subscribes to checks registered from now on. Past registrations are not replayed.
     */
    public Subscription<RegisteredCheck> subscribeForRegisteredChecks() {
        return ask(() -> {
            Subscription<RegisteredCheck> subscription =
                    new Subscription<>(SubscriptionHub.REGISTERED_CHECKS, this::unsubscribe);
            subscriptions.addRegisteredCheckSubscriber(subscription);
            return subscription;
        });
    }

    /**
     * Subscribes to every check result from now on.
     */
    public Subscription<CheckResult> subscribeForCheckResults() {
        return subscribeForCheckResults(null);
    }

    /**
     * Subscribes to check results accepted by {@code filter}; a null filter accepts all. The filter
     * runs on the coordinator thread and must not call back into the engine.
     */
    public Subscription<CheckResult> subscribeForCheckResults(Predicate<CheckResult> filter) {
        return ask(() -> {
            Subscription<CheckResult> subscription =
                    new Subscription<>(SubscriptionHub.CHECK_RESULTS, this::unsubscribe);
            subscriptions.addCheckResultSubscriber(subscription, filter);
            return subscription;
        });
    }

    /**
     * Subscribes to overall-health changes. The first element is the current overall health.
     */
    public Subscription<HealthStatus> subscribeForOverallHealthChanges() {
        return ask(() -> {
            Subscription<HealthStatus> subscription =
                    new Subscription<>(SubscriptionHub.OVERALL_HEALTH, this::unsubscribe);
            subscriptions.addOverallHealthSubscriber(subscription, results.overallHealth());
            return subscription;
        });
    }

    /**
     * Stops the engine. Idempotent.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Health engine shutting down");
        // wake the coordinator so it observes the stop flag
        commands.offer(() -> { });
        scheduler.shutdown();
        checkRunner.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        return stopped.get();
    }

    /**
     * Waits until the coordinator and scheduler threads have ended after {@link #shutdown()}.
     *
     * @return true if everything ended within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        coordinator.join(Math.max(1, timeout.toMillis()));
        if (coordinator.isAlive()) {
            return false;
        }
        return scheduler.awaitTermination(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
    }

    public HealthEngineOptions options() {
        return options;
    }

    int activeScheduleLoops() {
        return scheduler.activeLoops();
    }

    ConcurrencyLimiter limiter() {
        return scheduler.limiter();
    }

    private void runCoordinator() {
        try {
            while (!stopped.get()) {
                Runnable command = commands.take();
                if (!stopped.get()) {
                    runCommand(command);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Error e) {
            log.error("Health engine coordinator failed, stopping the engine", e);
            throw e;
        } finally {
            // the coordinator is gone, so nothing may keep posting to its queue
            stopped.set(true);
            scheduler.shutdown();
            checkRunner.shutdown();
            subscriptions.closeAll();
            commands.clear();
            pendingReplies.forEach(reply -> reply.completeExceptionally(new HealthEngineShutdownException()));
            log.info("Health engine stopped");
        }
    }

    private void runCommand(Runnable command) {
        try {
            command.run();
        } catch (RuntimeException e) {
            log.error("Health engine command failed", e);
        }
    }

    private HealthCheckRegistrationException applyRegistration(
            Check check, CheckerOptions requested, HealthCheck healthCheck) {
        if (healthCheck == null) {
            return new MissingCheckerException(check.id());
        }

        CheckerOptions effective = requested.withDefaults(options);
        Set<InvalidCheckerOptionsException.Violation> violations = validate(effective);
        if (!violations.isEmpty()) {
            return new InvalidCheckerOptionsException(check.id(), effective, violations);
        }

        if (checks.contains(check.id())) {
            return new DuplicateCheckException(check.id());
        }

        Checker checker = new TimeoutChecker(
                check.id(), healthCheck, effective.timeout(), checkRunner, this::reportResult);
        RegisteredCheck registered = new RegisteredCheck(check, effective, checker);
        checks.add(registered);
        scheduler.schedule(registered);
        subscriptions.publishRegisteredCheck(registered);
        log.info("Registered health check '{}' (timeout={}, runInterval={})",
                check.id(), effective.timeout(), effective.runInterval());
        return null;
    }

    private Set<InvalidCheckerOptionsException.Violation> validate(CheckerOptions effective) {
        Set<InvalidCheckerOptionsException.Violation> violations =
                EnumSet.noneOf(InvalidCheckerOptionsException.Violation.class);
        if (effective.runInterval().compareTo(options.minRunInterval()) < 0) {
            violations.add(InvalidCheckerOptionsException.Violation.RUN_INTERVAL_TOO_FREQUENT);
        }
        if (effective.timeout().compareTo(options.maxTimeout()) > 0) {
            violations.add(InvalidCheckerOptionsException.Violation.TIMEOUT_TOO_HIGH);
        }
        return violations;
    }

    private void reportResult(CheckResult result) {
        tell(() -> {
            boolean changed = results.record(result);
            if (changed) {
                log.info("Overall health changed to {} after result of '{}'", results.overallHealth(), result.checkId());
                subscriptions.publishOverallHealth(results.overallHealth());
            }
            subscriptions.publishCheckResult(result);
        });
    }

    private void unsubscribe(Subscription<?> subscription) {
        tell(() -> subscriptions.remove(subscription));
    }

    /**
     * Posts a command without waiting. Dropped once the engine is stopped.
     */
    private void tell(Runnable command) {
        if (!stopped.get()) {
            commands.offer(command);
        }
    }

    /**
     * Posts a command and waits for the coordinator to run it.
     */
    private <T> T ask(Supplier<T> request) {
        if (Thread.currentThread() == coordinator) {
            throw new IllegalStateException("health engine must not be called from its own coordinator thread");
        }
        if (stopped.get()) {
            throw new HealthEngineShutdownException();
        }
        CompletableFuture<T> reply = new CompletableFuture<>();
        pendingReplies.add(reply);
        try {
            commands.offer(() -> {
                try {
                    reply.complete(request.get());
                } catch (Throwable e) {
                    reply.completeExceptionally(e);
                }
            });
            // the coordinator stops before failing pending replies, so either it sees this reply
            // or this check sees the stop
            if (stopped.get()) {
                reply.completeExceptionally(new HealthEngineShutdownException());
            }
            return reply.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error cause) {
                throw cause;
            }
            throw e;
        } finally {
            pendingReplies.remove(reply);
        }
    }
}
