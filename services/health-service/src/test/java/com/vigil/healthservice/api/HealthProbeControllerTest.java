package com.vigil.healthservice.api;

import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vigil.health.Check;
import com.vigil.health.CheckerOptions;
import com.vigil.health.HealthCheckRegistry;
import com.vigil.health.HealthStatus;
import com.vigil.health.reporting.HealthProbes;
import com.vigil.health.testing.InMemoryHealthCheck;
import com.vigil.healthservice.infrastructure.web.GlobalExceptionHandler;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Tests for {@link HealthProbeController} against a real engine, without a Spring context.
 */
@DisplayName("HealthProbeController")
class HealthProbeControllerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final CheckerOptions RARELY = CheckerOptions.withRunInterval(Duration.ofMinutes(1));

    private HealthCheckRegistry registry;
    private HealthProbes probes;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        registry = new HealthCheckRegistry();
        probes = new HealthProbes(registry);
        mockMvc = MockMvcBuilders.standaloneSetup(new HealthProbeController(registry, probes))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        registry.shutdown();
        registry.awaitTermination(WAIT);
    }

    @Nested
    @DisplayName("GET /live")
    class Live {

        @Test
        @DisplayName("should answer 200 while the overall health is not RED")
        void shouldBeUp() throws Exception {
            mockMvc.perform(get("/api/v1/health/live"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("UP"))
                    .andExpect(jsonPath("$.overallHealth").value("GREEN"));
        }

        @Test
        @DisplayName("should answer 503 when the overall health is RED")
        void shouldBeDownWhenRed() throws Exception {
            registry.register(Check.of("postgres", "db", "down"), RARELY, new InMemoryHealthCheck().setRed("refused"));
            await().atMost(WAIT).until(() -> registry.overallHealth() == HealthStatus.RED);

            mockMvc.perform(get("/api/v1/health/live"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.status").value("DOWN"))
                    .andExpect(jsonPath("$.overallHealth").value("RED"));
        }
    }

    @Nested
    @DisplayName("GET /ready")
    class Ready {

        @Test
        @DisplayName("should answer 503 before startup checks passed")
        void shouldNotBeReadyInitially() throws Exception {
            mockMvc.perform(get("/api/v1/health/ready"))
                    .andExpect(status().isServiceUnavailable());
        }

        @Test
        @DisplayName("should answer 200 after startup checks passed")
        void shouldBeReadyAfterStartupChecks() throws Exception {
            registry.register(Check.of("postgres", "db", "down"), RARELY, new InMemoryHealthCheck());
            probes.runStartupChecks();

            mockMvc.perform(get("/api/v1/health/ready"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("UP"));
        }
    }

    @Nested
    @DisplayName("GET /checks")
    class Checks {

        @Test
        @DisplayName("should join registered checks with their latest result")
        void shouldJoinChecksWithResults() throws Exception {
            registry.register(new Check("postgres", "database connectivity", "slow writes", "orders lost"),
                    new CheckerOptions(Duration.ofSeconds(2), Duration.ofMinutes(1)),
                    new InMemoryHealthCheck().setYellow("replication lag"));
            await().atMost(WAIT).until(() -> registry.checkResults().size() == 1);

            mockMvc.perform(get("/api/v1/health/checks"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(1))
                    .andExpect(jsonPath("$[0].id").value("postgres"))
                    .andExpect(jsonPath("$[0].yellowImpact").value("slow writes"))
                    .andExpect(jsonPath("$[0].timeoutMs").value(2000))
                    .andExpect(jsonPath("$[0].runIntervalMs").value(60000))
                    .andExpect(jsonPath("$[0].status").value("YELLOW"))
                    .andExpect(jsonPath("$[0].error").value("health check failed: postgres : YELLOW: replication lag"));
        }

        @Test
        @DisplayName("should show a check by id")
        void shouldShowCheckById() throws Exception {
            registry.register(Check.of("redis", "cache", "down"), RARELY, new InMemoryHealthCheck());
            await().atMost(WAIT).until(() -> registry.checkResults().size() == 1);

            mockMvc.perform(get("/api/v1/health/checks/redis"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value("redis"))
                    .andExpect(jsonPath("$.status").value("GREEN"))
                    .andExpect(jsonPath("$.error").doesNotExist());
        }

        @Test
        @DisplayName("should answer 404 for an unknown check")
        void shouldAnswerNotFound() throws Exception {
            mockMvc.perform(get("/api/v1/health/checks/missing"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.status").value(404))
                    .andExpect(jsonPath("$.checkId").value("missing"));
        }
    }
}
