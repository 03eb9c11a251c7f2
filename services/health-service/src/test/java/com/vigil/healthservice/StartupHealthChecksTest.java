package com.vigil.healthservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.health.Check;
import com.vigil.health.CheckerOptions;
import com.vigil.health.HealthCheckRegistry;
import com.vigil.health.reporting.HealthProbes;
import com.vigil.health.reporting.StartupCheckException;
import com.vigil.health.testing.InMemoryHealthCheck;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

@DisplayName("StartupHealthChecks")
class StartupHealthChecksTest {

    private static final CheckerOptions RARELY = CheckerOptions.withRunInterval(Duration.ofMinutes(1));

    private final HealthCheckRegistry registry = new HealthCheckRegistry();
    private final HealthProbes probes = new HealthProbes(registry);
    private final StartupHealthChecks startupChecks = new StartupHealthChecks(probes);

    @AfterEach
    void tearDown() throws InterruptedException {
        registry.shutdown();
        registry.awaitTermination(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("marks the service ready when every check is GREEN")
    void marksReady() {
        registry.register(Check.of("postgres", "db", "down"), RARELY, new InMemoryHealthCheck());

        startupChecks.run(new DefaultApplicationArguments());

        assertThat(probes.isReady()).isTrue();
    }

    @Test
    @DisplayName("aborts startup when a check is not GREEN")
    void abortsStartup() {
        registry.register(Check.of("postgres", "db", "down"), RARELY, new InMemoryHealthCheck().setRed("refused"));

        assertThatThrownBy(() -> startupChecks.run(new DefaultApplicationArguments()))
                .isInstanceOf(StartupCheckException.class)
                .hasMessageContaining("postgres=RED");
        assertThat(probes.isReady()).isFalse();
    }
}
