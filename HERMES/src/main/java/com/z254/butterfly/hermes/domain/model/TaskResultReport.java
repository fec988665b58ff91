package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Task result as sent by an agent, either over REST or in a {@code report_task_result} message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResultReport {

    private String agentId;

    private String taskId;

    private boolean success;

    private Map<String, Object> result;

    private String error;

    private TaskMetrics metrics;

    public TaskOutcome toOutcome() {
        return new TaskOutcome(success, result, error, metrics);
    }
}
