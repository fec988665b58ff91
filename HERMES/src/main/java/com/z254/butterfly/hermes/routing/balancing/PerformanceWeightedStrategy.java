package com.z254.butterfly.hermes.routing.balancing;

import com.z254.butterfly.hermes.domain.model.RoutingStrategy;
import com.z254.butterfly.hermes.domain.model.RoutingTableEntry;
import com.z254.butterfly.hermes.domain.model.ServerPerformance;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the candidate with the best composite score.
 * The score averages four equally weighted parts: inverse latency, success rate, spare capacity and a
 * health bonus.
 */
@Component
public class PerformanceWeightedStrategy implements LoadBalancingStrategy {

    @Override
    public RoutingStrategy getStrategy() {
        return RoutingStrategy.PERFORMANCE;
    }

    @Override
    public Optional<RoutingTableEntry> select(List<RoutingTableEntry> candidates, long messageCount) {
        RoutingTableEntry best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (RoutingTableEntry candidate : candidates) {
            double score = score(candidate);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    public static double score(RoutingTableEntry entry) {
        ServerPerformance performance = entry.getPerformance();
        double latencyScore = 1000.0 / Math.max(performance.getAverageLatency(), 1.0);
        double reliabilityScore = performance.getSuccessRate();
        double loadScore = 100.0 - entry.getLoad();
        double healthScore = entry.healthState().scoreBonus();
        return (latencyScore + reliabilityScore + loadScore + healthScore) / 4.0;
    }
}
