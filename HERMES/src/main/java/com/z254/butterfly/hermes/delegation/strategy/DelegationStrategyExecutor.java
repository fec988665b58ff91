package com.z254.butterfly.hermes.delegation.strategy;

import com.z254.butterfly.hermes.domain.model.DelegationStrategyType;
import com.z254.butterfly.hermes.domain.model.SubAgentTask;
import com.z254.butterfly.hermes.domain.model.TaskExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for delegation strategy executors.
 * Each strategy decides how the tasks of a delegation are handed to agents.
 */
public interface DelegationStrategyExecutor {

    /**
     * Get the strategy this executor implements.
     */
    DelegationStrategyType getStrategy();

    /**
     * Execute the tasks of a delegation.
     *
     * @param tasks      Tasks in request order
     * @param dispatcher Coordinator operations for this delegation
     * @return Final executions of the tasks that were started, in task order
     */
    Mono<List<TaskExecution>> execute(List<SubAgentTask> tasks, TaskDispatcher dispatcher);

    /**
     * Poll a task until it reaches a terminal state.
     */
    static Mono<TaskExecution> awaitTerminal(String taskId, TaskDispatcher dispatcher) {
        return Flux.interval(java.time.Duration.ZERO, dispatcher.pollInterval())
                .onBackpressureDrop()
                .map(tick -> dispatcher.refresh(taskId))
                .filter(execution -> execution.getStatus().isTerminal())
                .next();
    }

    /**
     * Poll a set of tasks until none of them is pending or in progress.
     */
    static Mono<List<TaskExecution>> awaitAll(List<String> taskIds, TaskDispatcher dispatcher) {
        if (taskIds.isEmpty()) {
            return Mono.just(List.of());
        }
        return Flux.interval(java.time.Duration.ZERO, dispatcher.pollInterval())
                .onBackpressureDrop()
                .map(tick -> taskIds.stream().map(dispatcher::refresh).toList())
                .filter(executions -> executions.stream().allMatch(execution -> execution.getStatus().isTerminal()))
                .next();
    }
}
