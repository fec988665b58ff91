package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rolling performance figures for a sub-agent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentPerformance {

    /**
     * Share of successful tasks, 0..100.
     */
    @Builder.Default
    private double successRate = 100.0;

    /**
     * Relative efficiency, 0..100. Weighs agent selection.
     */
    @Builder.Default
    private double efficiency = 100.0;

    /**
     * Smoothed task duration in milliseconds.
     */
    private double averageExecutionTime;

    /**
     * Share of failed or timed-out tasks, 0..1.
     */
    private double errorRate;

    private long tasksCompleted;

    private long tasksFailed;
}
