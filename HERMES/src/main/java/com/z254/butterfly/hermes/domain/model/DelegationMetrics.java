package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class DelegationMetrics {
    /**
     * Sum of completed task durations in milliseconds.
     */
    long totalExecutionTime;
    double averageTaskTime;
    long wallClockTime;
    /**
     * Serial time over wall-clock time, capped at 100.
     */
    double parallelEfficiency;
    /**
     * Number of executions handled per agent.
     */
    Map<String, Integer> agentUtilization;
    QualityMetrics qualityMetrics;
    ResourceUtilization resourceUtilization;
}
