package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of coordinator statistics.
 */
@Value
@Builder
public class CoordinationMetrics {
    int registeredAgents;
    int availableAgents;
    int activeTasks;
    int totalCapacity;
    /**
     * Active tasks over total capacity, 0..1.
     */
    double systemLoad;
    int activeDelegations;
    long tasksAssigned;
    long tasksCompleted;
    long tasksFailed;
    long tasksTimedOut;
    long delegationsCompleted;
    long delegationsFailed;
}
