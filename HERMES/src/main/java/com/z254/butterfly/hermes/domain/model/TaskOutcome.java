package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Result reported by an agent for a task it was given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskOutcome {

    private boolean success;

    private Map<String, Object> result;

    private String error;

    private TaskMetrics metrics;

    public static TaskOutcome completed(Map<String, Object> result, TaskMetrics metrics) {
        return new TaskOutcome(true, result, null, metrics);
    }

    public static TaskOutcome failed(String error) {
        return new TaskOutcome(false, null, error, null);
    }
}
