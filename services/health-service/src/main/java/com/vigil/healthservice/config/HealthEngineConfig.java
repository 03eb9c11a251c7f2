package com.vigil.healthservice.config;

import com.vigil.health.HealthCheckRegistry;
import com.vigil.health.reporting.CheckResultLogger;
import com.vigil.health.reporting.HealthMetrics;
import com.vigil.health.reporting.HealthProbes;
import com.vigil.healthservice.checks.JvmMemoryHealthCheck;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

/**
 * Wires the health engine and its reporting into the application context.
 *
 * <p>The result logger and metrics subscribe before the built-in checks are registered, so their
 * registrations are logged and get a status gauge. The engine is shut down with the context.
 */
@Configuration
public class HealthEngineConfig {

    @Bean(destroyMethod = "shutdown")
    public HealthCheckRegistry healthCheckRegistry(HealthEngineProperties properties) {
        return new HealthCheckRegistry(properties.toOptions());
    }

    @Bean(destroyMethod = "close")
    public CheckResultLogger checkResultLogger(HealthCheckRegistry registry) {
        return new CheckResultLogger(registry).start();
    }

    @Bean(destroyMethod = "close")
    public HealthMetrics healthMetrics(
            HealthCheckRegistry registry, MeterRegistry meterRegistry, HealthEngineProperties properties) {
        return new HealthMetrics(registry, meterRegistry, properties.serviceName()).start();
    }

    @Bean
    @DependsOn({"checkResultLogger", "healthMetrics"})
    public JvmMemoryHealthCheck jvmMemoryHealthCheck(HealthCheckRegistry registry) {
        var check = new JvmMemoryHealthCheck();
        registry.register(JvmMemoryHealthCheck.CHECK, check);
        return check;
    }

    @Bean
    public HealthProbes healthProbes(HealthCheckRegistry registry) {
        return new HealthProbes(registry);
    }
}
