package com.z254.butterfly.hermes.domain.model;

public enum AggregationMethod {
    MERGE,
    SELECT_BEST,
    VOTE,
    WEIGHTED_AVERAGE,
    CUSTOM
}
