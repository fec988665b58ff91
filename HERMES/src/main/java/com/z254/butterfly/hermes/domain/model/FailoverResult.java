package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FailoverResult {
    boolean success;
    String originalTarget;
    String failoverTarget;
    String reason;
}
