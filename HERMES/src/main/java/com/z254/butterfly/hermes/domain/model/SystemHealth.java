package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated health of the engine. The overall state is the worst component state.
 */
@Value
@Builder
public class SystemHealth {
    HealthState overall;
    List<ComponentHealth> components;
    Instant timestamp;
}
