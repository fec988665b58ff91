package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Computed route for a message.
 */
@Value
@Builder
public class Route {

    String targetServer;

    /**
     * Servers visited while resolving the route, primary first.
     */
    List<String> path;

    double estimatedLatency;

    /**
     * Expected delivery reliability, 0..1.
     */
    double reliability;

    double cost;
}
