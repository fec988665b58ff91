package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OptimizationSuggestion {

    public enum Type { LOAD_REBALANCING, AGENT_PERFORMANCE, CAPACITY }

    Type type;
    String description;
    List<String> affectedAgents;
    /**
     * Expected improvement in percent.
     */
    double expectedImprovement;
}
