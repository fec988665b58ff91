package com.z254.butterfly.hermes.routing.balancing;

import com.z254.butterfly.hermes.domain.model.RoutingStrategy;
import com.z254.butterfly.hermes.domain.model.RoutingTableEntry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Cycles through candidates using the routed message count.
 */
@Component
public class RoundRobinStrategy implements LoadBalancingStrategy {

    @Override
    public RoutingStrategy getStrategy() {
        return RoutingStrategy.ROUND_ROBIN;
    }

    @Override
    public Optional<RoutingTableEntry> select(List<RoutingTableEntry> candidates, long messageCount) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        int index = (int) Math.floorMod(messageCount, (long) candidates.size());
        return Optional.of(candidates.get(index));
    }
}
