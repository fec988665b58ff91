package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Read-only snapshot of aggregate router statistics.
 */
@Value
@Builder
public class RoutingMetrics {
    long totalMessages;
    long successfulMessages;
    /**
     * Smoothed routing latency in milliseconds.
     */
    double routingLatency;
    /**
     * Rolling success rate, 0..100: an exponential moving average of routing outcomes
     * seeded by the first one. 100 when nothing was routed yet.
     */
    double successRate;
    long failoverCount;
    /**
     * Messages delivered per server.
     */
    Map<String, Long> loadBalance;
    Map<String, CircuitState> circuitBreakerStates;
}
