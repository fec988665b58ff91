package com.z254.butterfly.hermes.routing.balancing;

import com.z254.butterfly.hermes.domain.model.RoutingStrategy;
import com.z254.butterfly.hermes.domain.model.RoutingTableEntry;

import java.util.List;
import java.util.Optional;

/**
 * Interface for load-balancing strategies.
 * The active strategy is chosen by configuration.
 */
public interface LoadBalancingStrategy {

    /**
     * Get the strategy this executor implements.
     */
    RoutingStrategy getStrategy();

    /**
     * Pick one server among eligible candidates.
     *
     * @param candidates   Eligible servers in routing table order
     * @param messageCount Number of messages routed so far
     * @return The chosen server, or empty when there are no candidates
     */
    Optional<RoutingTableEntry> select(List<RoutingTableEntry> candidates, long messageCount);
}
