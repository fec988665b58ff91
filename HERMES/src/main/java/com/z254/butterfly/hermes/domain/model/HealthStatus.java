package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of the most recent health probe of a server.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatus {

    @Builder.Default
    private HealthState status = HealthState.HEALTHY;

    private Instant lastCheck;

    /**
     * Probe round-trip time in milliseconds.
     */
    private long responseTime;

    private double errorRate;

    private String error;

    public static HealthStatus healthy() {
        return HealthStatus.builder().status(HealthState.HEALTHY).lastCheck(Instant.now()).build();
    }
}
