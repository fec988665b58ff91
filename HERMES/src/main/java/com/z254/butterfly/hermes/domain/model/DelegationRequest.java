package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * A unit of work split into sub-agent tasks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DelegationRequest {

    private String delegationId;

    private String parentTaskId;

    @Builder.Default
    private List<SubAgentTask> tasks = new ArrayList<>();

    @Builder.Default
    private DelegationStrategyType strategy = DelegationStrategyType.PARALLEL;

    @Builder.Default
    private AggregationRules aggregation = new AggregationRules();

    /**
     * Optional cap for the whole delegation. Tasks still running at the deadline time out.
     */
    private Duration timeout;
}
