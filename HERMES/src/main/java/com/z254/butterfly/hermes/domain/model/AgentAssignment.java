package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Suggested agent for a task, with the next best alternatives.
 */
@Value
@Builder
public class AgentAssignment {
    String taskId;
    /**
     * Null when no agent can take the task.
     */
    String agentId;
    String reason;
    List<String> alternatives;
}
