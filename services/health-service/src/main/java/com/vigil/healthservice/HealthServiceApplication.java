package com.vigil.healthservice;

import com.vigil.healthservice.config.HealthEngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Vigil Health Service: hosts the health engine and exposes its state over HTTP.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Health engine built from {@code vigil.health.*} with the built-in JVM memory check
 *   <li>Startup checks: the application only starts if every registered check is GREEN
 *   <li>Liveness, readiness and per-check status under {@code /api/v1/health}
 *   <li>Actuator health (engine contributor) and Prometheus endpoints
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(HealthEngineProperties.class)
public class HealthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(HealthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HealthServiceApplication.class, args);
        log.info("Vigil Health Service started successfully");
    }
}
