package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Smoothed delivery statistics for one server.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ServerPerformance {

    /**
     * Exponential moving average of delivery latency in milliseconds.
     */
    @Builder.Default
    private double averageLatency = 10.0;

    /**
     * Exponential moving average of delivery success, 0..100.
     */
    @Builder.Default
    private double successRate = 100.0;

    private long deliveries;

    private long failures;
}
