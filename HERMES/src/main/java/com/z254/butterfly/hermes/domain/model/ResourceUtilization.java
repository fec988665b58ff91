package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Host resource usage in percent.
 */
@Value
@Builder
public class ResourceUtilization {
    double cpu;
    double memory;
    double network;
    double storage;
}
