package com.z254.butterfly.hermes.delegation;

import com.z254.butterfly.hermes.domain.model.AggregationMethod;
import com.z254.butterfly.hermes.domain.model.AggregationRules;
import com.z254.butterfly.hermes.domain.model.TaskExecution;
import com.z254.butterfly.hermes.domain.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Service responsible for combining the results of sub-agent task executions.
 * Only completed executions with a non-empty result take part. All methods are
 * independent of execution order except for tie-breaking, which favours the earlier execution.
 */
@Service
@Slf4j
public class ResultAggregator {

    /**
     * Weight used by weighted_average when an execution reports no quality score.
     */
    static final double DEFAULT_WEIGHT = 1.0;

    /**
     * Aggregate execution results.
     *
     * @param executions Executions of one delegation
     * @param rules      Aggregation rules, null for merge
     * @return The aggregated result
     * @throws AggregationException when no execution qualifies
     */
    public Map<String, Object> aggregate(List<TaskExecution> executions, AggregationRules rules) {
        AggregationMethod method = rules != null && rules.getMethod() != null
                ? rules.getMethod() : AggregationMethod.MERGE;
        List<TaskExecution> qualifying = qualifying(executions);
        if (qualifying.isEmpty()) {
            throw new AggregationException("No successful task results to aggregate");
        }

        log.debug("Aggregating {} results using method: {}", qualifying.size(), method);

        return switch (method) {
            case MERGE, CUSTOM -> merge(qualifying);
            case SELECT_BEST -> selectBest(qualifying);
            case VOTE -> vote(qualifying);
            case WEIGHTED_AVERAGE -> weightedAverage(qualifying);
        };
    }

    /**
     * Share of qualifying results equal to the most common one, 0..1. Zero when nothing qualifies.
     */
    public double consistency(List<TaskExecution> executions) {
        List<TaskExecution> qualifying = qualifying(executions);
        if (qualifying.isEmpty()) {
            return 0.0;
        }
        return (double) tally(qualifying).get(0).count / qualifying.size();
    }

    // --------------------------------------------------------------------------------------------
    // Methods
    // --------------------------------------------------------------------------------------------

    /**
     * Shallow union of result maps; later executions overwrite earlier keys.
     */
    private Map<String, Object> merge(List<TaskExecution> executions) {
        Map<String, Object> merged = new LinkedHashMap<>();
        executions.forEach(execution -> merged.putAll(execution.getResult()));
        return merged;
    }

    private Map<String, Object> selectBest(List<TaskExecution> executions) {
        TaskExecution best = executions.get(0);
        for (TaskExecution execution : executions) {
            if (execution.qualityScoreOr(0.0) > best.qualityScoreOr(0.0)) {
                best = execution;
            }
        }
        return new LinkedHashMap<>(best.getResult());
    }

    /**
     * Plurality by deep equality of the whole result.
     */
    private Map<String, Object> vote(List<TaskExecution> executions) {
        VoteCount winner = tally(executions).get(0);
        log.debug("Vote winner received {} of {} votes", winner.count, executions.size());
        return new LinkedHashMap<>(winner.result);
    }

    /**
     * Per numeric field: sum(value * weight) / sum(weight), weight = quality score.
     * Fields that are numeric in no result are left out.
     */
    private Map<String, Object> weightedAverage(List<TaskExecution> executions) {
        boolean allZero = executions.stream().allMatch(execution -> weight(execution) == 0.0);

        Map<String, double[]> sums = new LinkedHashMap<>();
        for (TaskExecution execution : executions) {
            double weight = allZero ? DEFAULT_WEIGHT : weight(execution);
            for (Map.Entry<String, Object> field : execution.getResult().entrySet()) {
                if (field.getValue() instanceof Number) {
                    double value = ((Number) field.getValue()).doubleValue();
                    double[] sum = sums.computeIfAbsent(field.getKey(), key -> new double[2]);
                    sum[0] += value * weight;
                    sum[1] += weight;
                }
            }
        }

        Map<String, Object> averaged = new LinkedHashMap<>();
        sums.forEach((field, sum) -> {
            if (sum[1] > 0) {
                averaged.put(field, sum[0] / sum[1]);
            }
        });
        return averaged;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private List<TaskExecution> qualifying(List<TaskExecution> executions) {
        if (executions == null) {
            return List.of();
        }
        return executions.stream()
                .filter(Objects::nonNull)
                .filter(execution -> execution.getStatus() == TaskStatus.COMPLETED)
                .filter(TaskExecution::hasResult)
                .toList();
    }

    private double weight(TaskExecution execution) {
        return Math.max(0.0, execution.qualityScoreOr(DEFAULT_WEIGHT));
    }

    /**
     * Distinct results with their vote counts, most votes first; ties keep first-seen order.
     */
    private List<VoteCount> tally(List<TaskExecution> executions) {
        List<VoteCount> counts = new ArrayList<>();
        for (TaskExecution execution : executions) {
            VoteCount match = null;
            for (VoteCount candidate : counts) {
                if (candidate.result.equals(execution.getResult())) {
                    match = candidate;
                    break;
                }
            }
            if (match == null) {
                counts.add(new VoteCount(execution.getResult()));
            } else {
                match.count++;
            }
        }
        counts.sort(Comparator.comparingInt((VoteCount count) -> count.count).reversed());
        return counts;
    }

    private static class VoteCount {
        final Map<String, Object> result;
        int count = 1;

        VoteCount(Map<String, Object> result) {
            this.result = result;
        }
    }

    /**
     * Raised when there is nothing to aggregate.
     */
    public static class AggregationException extends RuntimeException {
        public AggregationException(String message) {
            super(message);
        }
    }
}
