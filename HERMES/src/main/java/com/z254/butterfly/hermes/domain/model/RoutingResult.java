package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of routing a single message. Routing failures are reported here, never thrown.
 */
@Value
@Builder
public class RoutingResult {

    boolean success;

    String messageId;

    String targetServer;

    List<String> routingPath;

    /**
     * Delivery latency in milliseconds.
     */
    long latency;

    boolean failedOver;

    String error;

    Map<String, Object> response;

    public static RoutingResult failure(String messageId, String targetServer, List<String> path,
                                        long latency, String error) {
        return RoutingResult.builder()
                .success(false)
                .messageId(messageId)
                .targetServer(targetServer)
                .routingPath(path != null ? path : List.of())
                .latency(latency)
                .error(error)
                .build();
    }
}
