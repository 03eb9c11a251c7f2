package com.vigil.healthservice;

import com.vigil.health.CheckResult;
import com.vigil.health.reporting.HealthProbes;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs every registered health check once when the application starts.
 *
 * <p>If any check is not GREEN the {@link com.vigil.health.reporting.StartupCheckException}
 * propagates and the application fails to start; otherwise the service becomes ready.
 */
@Component
public class StartupHealthChecks implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupHealthChecks.class);

    private final HealthProbes probes;

    public StartupHealthChecks(HealthProbes probes) {
        this.probes = probes;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running startup health checks");
        List<CheckResult> results = probes.runStartupChecks();
        results.forEach(result -> log.info("Startup check '{}' is {} ({})",
                result.checkId(), result.status(), result.duration()));
    }
}
