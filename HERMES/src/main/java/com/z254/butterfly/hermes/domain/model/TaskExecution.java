package com.z254.butterfly.hermes.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Tracks one attempt at executing a {@link SubAgentTask}.
 * The assigned agent never changes; a reassignment creates a new execution.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskExecution {

    private String executionId;

    @Setter(AccessLevel.NONE)
    private String taskId;

    /**
     * Agent holding the task. Empty when no agent could be assigned.
     */
    @Setter(AccessLevel.NONE)
    private String agentId;

    private String delegationId;

    private TaskStatus status;

    private Instant startTime;

    private Instant endTime;

    private Map<String, Object> result;

    private String error;

    private TaskMetrics metrics;

    /**
     * 1 for the first attempt, incremented on every reassignment.
     */
    private int attempt;

    /**
     * Time from assignment to the terminal state, or null while still running.
     */
    @JsonIgnore
    public Duration getDuration() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return Duration.between(startTime, endTime);
    }

    @JsonIgnore
    public boolean hasResult() {
        return result != null && !result.isEmpty();
    }

    @JsonIgnore
    public double qualityScoreOr(double fallback) {
        return metrics != null && metrics.getQualityScore() != null ? metrics.getQualityScore() : fallback;
    }

    /**
     * Snapshot copy for readers.
     */
    public TaskExecution copy() {
        return toBuilder().build();
    }
}
