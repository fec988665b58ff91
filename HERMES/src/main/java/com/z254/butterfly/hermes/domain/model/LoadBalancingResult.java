package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class LoadBalancingResult {
    String selectedServer;
    /**
     * Current load per candidate server.
     */
    Map<String, Double> loadDistribution;
    RoutingStrategy strategy;
}
