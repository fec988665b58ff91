package com.z254.butterfly.hermes.resource;

import com.z254.butterfly.hermes.domain.model.ResourceUtilization;

/**
 * Source of host resource usage attached to delegation metrics.
 */
public interface ResourceUtilizationProbe {

    ResourceUtilization sample();
}
