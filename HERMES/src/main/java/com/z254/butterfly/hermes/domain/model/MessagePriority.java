package com.z254.butterfly.hermes.domain.model;

/**
 * Delivery priority of a message or sub-agent task.
 * Declaration order matters: the ordinal is used as the routing cost penalty weight.
 */
public enum MessagePriority {
    CRITICAL(0.8),
    HIGH(1.0),
    NORMAL(1.0),
    LOW(1.0),
    BACKGROUND(1.5);

    private final double latencyFactor;

    MessagePriority(double latencyFactor) {
        this.latencyFactor = latencyFactor;
    }

    /**
     * Multiplier applied to a server's smoothed latency when estimating route latency.
     */
    public double latencyFactor() {
        return latencyFactor;
    }

    /**
     * Cost penalty contributed by this priority, lower for more urgent messages.
     */
    public double costPenalty() {
        return ordinal() * 5.0;
    }
}
