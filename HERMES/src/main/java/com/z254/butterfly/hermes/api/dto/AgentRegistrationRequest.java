package com.z254.butterfly.hermes.api.dto;

import com.z254.butterfly.hermes.domain.model.AgentPerformance;
import com.z254.butterfly.hermes.domain.model.SubAgent;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Request DTO for registering a sub-agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRegistrationRequest {

    @NotBlank(message = "Agent ID is required")
    private String agentId;

    @NotBlank(message = "Server ID is required")
    private String serverId;

    private String name;

    @NotEmpty(message = "At least one capability is required")
    private Set<String> capabilities;

    private Set<String> specializations;

    @Builder.Default
    @Min(value = 1, message = "maxConcurrentTasks must be positive")
    private int maxConcurrentTasks = 3;

    /**
     * Initial efficiency, 0..100. Defaults to 100.
     */
    private Double efficiency;

    /**
     * Convert to domain model.
     */
    public SubAgent toAgent() {
        AgentPerformance performance = new AgentPerformance();
        if (efficiency != null) {
            performance.setEfficiency(efficiency);
        }
        return SubAgent.builder()
                .agentId(agentId)
                .serverId(serverId)
                .name(name != null ? name : agentId)
                .capabilities(new LinkedHashSet<>(capabilities))
                .specializations(specializations != null ? new LinkedHashSet<>(specializations) : new LinkedHashSet<>())
                .maxConcurrentTasks(maxConcurrentTasks)
                .performance(performance)
                .build();
    }
}
