package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one server's circuit breaker.
 */
@Value
@Builder
public class CircuitBreakerState {
    String serverId;
    CircuitState state;
    /**
     * Consecutive failures since the last success.
     */
    int failureCount;
    Instant lastFailure;
    Instant openedAt;
}
