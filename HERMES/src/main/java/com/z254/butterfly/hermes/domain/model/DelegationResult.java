package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a delegation. Partial failures are reported here alongside the successes.
 */
@Value
@Builder
public class DelegationResult {

    String delegationId;

    /**
     * True when at least one task completed and the results could be aggregated.
     */
    boolean success;

    DelegationStrategyType strategy;

    int totalTasks;

    int completedTasks;

    /**
     * Executions that ended failed, timed out or cancelled.
     */
    int failedTasks;

    /**
     * Tasks never started because a sequential or pipeline run halted.
     */
    int skippedTasks;

    List<TaskExecution> taskResults;

    Map<String, Object> aggregatedResult;

    String error;

    DelegationMetrics metrics;

    Instant startTime;

    Instant endTime;
}
