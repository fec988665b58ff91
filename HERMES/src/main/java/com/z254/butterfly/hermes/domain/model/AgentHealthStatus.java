package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AgentHealthStatus {
    String agentId;
    AgentStatus status;
    double load;
    double errorRate;
    Instant lastHeartbeat;
    List<String> issues;

    public boolean isHealthy() {
        return issues == null || issues.isEmpty();
    }
}
