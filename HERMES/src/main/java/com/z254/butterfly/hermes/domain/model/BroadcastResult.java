package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BroadcastResult {

    /**
     * True when at least one target received the message.
     */
    boolean success;

    int deliveredCount;

    List<String> failedTargets;

    /**
     * Mean per-target delivery latency in milliseconds.
     */
    double averageLatency;

    List<RoutingResult> results;
}
