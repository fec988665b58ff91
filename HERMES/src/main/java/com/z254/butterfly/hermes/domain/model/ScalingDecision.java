package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Recommendation for the size of the agent pool.
 */
@Value
@Builder
public class ScalingDecision {
    ScalingAction action;
    int currentAgents;
    int targetAgents;
    double utilization;
    String reason;
    /**
     * Confidence in the recommendation, 0..100.
     */
    int confidence;
    /**
     * Estimated performance impact in percent.
     */
    int estimatedImpact;
}
