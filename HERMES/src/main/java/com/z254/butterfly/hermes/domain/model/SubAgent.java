package com.z254.butterfly.hermes.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A worker agent hosted on a server that can execute delegated tasks.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SubAgent {

    /**
     * Capability that matches every operation.
     */
    public static final String WILDCARD_CAPABILITY = "*";

    /**
     * Unique identifier of this agent.
     */
    private String agentId;

    /**
     * Server that hosts the agent. Task deliveries are routed here.
     */
    private String serverId;

    private String name;

    /**
     * Operations this agent can execute.
     */
    @Builder.Default
    private Set<String> capabilities = new LinkedHashSet<>();

    /**
     * Operations this agent is particularly good at. Boosts selection score.
     */
    @Builder.Default
    private Set<String> specializations = new LinkedHashSet<>();

    @Builder.Default
    private AgentStatus status = AgentStatus.AVAILABLE;

    /**
     * Ids of tasks currently held by this agent.
     */
    @Builder.Default
    private List<String> currentTasks = new ArrayList<>();

    @Builder.Default
    private int maxConcurrentTasks = 3;

    @Builder.Default
    private AgentPerformance performance = new AgentPerformance();

    private Instant lastHeartbeat;

    private Instant registeredAt;

    @JsonIgnore
    public double getLoad() {
        if (maxConcurrentTasks <= 0) {
            return 1.0;
        }
        return (double) currentTasks.size() / maxConcurrentTasks;
    }

    @JsonIgnore
    public boolean hasSpareCapacity() {
        return currentTasks.size() < maxConcurrentTasks;
    }

    public boolean canHandle(String operation) {
        return capabilities.contains(WILDCARD_CAPABILITY) || capabilities.contains(operation);
    }

    /**
     * Detached copy safe to hand out to readers.
     */
    public SubAgent copy() {
        return toBuilder()
                .capabilities(new LinkedHashSet<>(capabilities))
                .specializations(specializations != null ? new LinkedHashSet<>(specializations) : new LinkedHashSet<>())
                .currentTasks(new ArrayList<>(currentTasks))
                .performance(performance != null ? performance.toBuilder().build() : new AgentPerformance())
                .build();
    }
}
