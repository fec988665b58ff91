package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ComponentHealth {
    String name;
    HealthState status;
    Map<String, Object> details;
}
