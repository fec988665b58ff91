package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Quality figures an agent reports together with a task result.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskMetrics {

    /**
     * Execution time in milliseconds.
     */
    private long executionTime;

    /**
     * Overall quality of the result, 0..1. Drives select_best and weighted_average.
     */
    private Double qualityScore;

    private Double accuracy;

    private Double completeness;
}
