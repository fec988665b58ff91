package com.z254.butterfly.hermes.domain.model;

/**
 * Load-balancing strategy used when the router chooses among servers.
 */
public enum RoutingStrategy {
    PERFORMANCE,
    ROUND_ROBIN,
    LEAST_CONNECTIONS
}
