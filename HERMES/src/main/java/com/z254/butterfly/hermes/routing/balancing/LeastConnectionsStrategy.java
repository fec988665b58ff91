package com.z254.butterfly.hermes.routing.balancing;

import com.z254.butterfly.hermes.domain.model.RoutingStrategy;
import com.z254.butterfly.hermes.domain.model.RoutingTableEntry;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the candidate reporting the lowest load. Ties go to the earlier table entry.
 */
@Component
public class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public RoutingStrategy getStrategy() {
        return RoutingStrategy.LEAST_CONNECTIONS;
    }

    @Override
    public Optional<RoutingTableEntry> select(List<RoutingTableEntry> candidates, long messageCount) {
        return candidates.stream().min(Comparator.comparingDouble(RoutingTableEntry::getLoad));
    }
}
