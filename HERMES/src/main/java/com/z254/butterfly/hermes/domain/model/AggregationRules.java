package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationRules {

    @Builder.Default
    private AggregationMethod method = AggregationMethod.MERGE;

    public static AggregationRules of(AggregationMethod method) {
        return new AggregationRules(method);
    }
}
