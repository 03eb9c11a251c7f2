package com.vigil.healthservice.api;

import com.vigil.health.CheckResult;
import com.vigil.health.HealthCheckRegistry;
import com.vigil.health.RegisteredCheck;
import com.vigil.health.reporting.HealthProbes;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness, readiness and per-check status of the health engine.
 *
 * <p>Probes answer 200 when up and 503 when down, so orchestrators can use them directly.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthProbeController {

    private final HealthCheckRegistry registry;
    private final HealthProbes probes;

    public HealthProbeController(HealthCheckRegistry registry, HealthProbes probes) {
        this.registry = registry;
        this.probes = probes;
    }

    @GetMapping("/live")
    public ResponseEntity<ProbeResponse> live() {
        return probe(probes.isAlive());
    }

    @GetMapping("/ready")
    public ResponseEntity<ProbeResponse> ready() {
        return probe(probes.isReady());
    }

    @GetMapping("/checks")
    public List<CheckStatusResponse> checks() {
        Map<String, CheckResult> latest = registry.checkResults().stream()
                .collect(Collectors.toMap(CheckResult::checkId, Function.identity()));
        return registry.registeredChecks().stream()
                .map(check -> CheckStatusResponse.of(check, latest.get(check.id())))
                .toList();
    }

    @GetMapping("/checks/{id}")
    public CheckStatusResponse check(@PathVariable("id") String id) {
        RegisteredCheck check = registry.registeredCheck(id)
                .orElseThrow(() -> new UnknownHealthCheckException(id));
        CheckResult result = registry.checkResults(r -> r.checkId().equals(id)).stream()
                .findFirst()
                .orElse(null);
        return CheckStatusResponse.of(check, result);
    }

    private ResponseEntity<ProbeResponse> probe(boolean up) {
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(ProbeResponse.of(up, registry.overallHealth()));
    }
}
