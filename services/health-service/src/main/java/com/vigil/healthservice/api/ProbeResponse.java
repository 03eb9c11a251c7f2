package com.vigil.healthservice.api;

import com.vigil.health.HealthStatus;

/**
 * Body of the liveness and readiness probes.
 *
 * @param status "UP" or "DOWN"
 * @param overallHealth current overall health of the engine
 */
public record ProbeResponse(String status, HealthStatus overallHealth) {

    public static ProbeResponse of(boolean up, HealthStatus overallHealth) {
        return new ProbeResponse(up ? "UP" : "DOWN", overallHealth);
    }
}
