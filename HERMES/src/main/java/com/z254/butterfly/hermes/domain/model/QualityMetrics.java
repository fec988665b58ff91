package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Quality figures averaged over the completed executions of a delegation, all 0..100.
 */
@Value
@Builder
public class QualityMetrics {
    double accuracy;
    double completeness;
    double consistency;
    double confidence;

    public static QualityMetrics empty() {
        return QualityMetrics.builder().build();
    }
}
