package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of work delegated to a single sub-agent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SubAgentTask {

    private String taskId;

    /**
     * Operation name matched against agent capabilities.
     */
    private String operation;

    @Builder.Default
    private Map<String, Object> input = new LinkedHashMap<>();

    @Builder.Default
    private MessagePriority priority = MessagePriority.NORMAL;

    /**
     * Time allowed in progress before the execution becomes {@link TaskStatus#TIMEOUT}.
     * Null means the configured default.
     */
    private Duration timeout;

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    private int retries;

    @Builder.Default
    private int maxRetries = 2;
}
