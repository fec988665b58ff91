package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Constraints for picking a target server outside of a concrete message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectionCriteria {

    private String operation;

    @Builder.Default
    private Set<String> requiredCapabilities = new HashSet<>();

    private boolean prioritizeLatency;

    private boolean prioritizeReliability;

    @Builder.Default
    private Set<String> excludeServers = new HashSet<>();
}
