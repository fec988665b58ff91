package com.z254.butterfly.hermes.delegation.strategy;

import com.z254.butterfly.hermes.domain.model.DelegationStrategyType;
import com.z254.butterfly.hermes.domain.model.SubAgentTask;
import com.z254.butterfly.hermes.domain.model.TaskExecution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Sequential delegation.
 * Each task is assigned only after the previous one reached a terminal state; the run stops at the
 * first task that did not complete.
 */
@Component
@Slf4j
public class SequentialStrategy implements DelegationStrategyExecutor {

    @Override
    public DelegationStrategyType getStrategy() {
        return DelegationStrategyType.SEQUENTIAL;
    }

    @Override
    public Mono<List<TaskExecution>> execute(List<SubAgentTask> tasks, TaskDispatcher dispatcher) {
        log.info("Executing sequential delegation {} with {} tasks", dispatcher.delegationId(), tasks.size());

        return Flux.fromIterable(tasks)
                .concatMap(task -> runToCompletion(task, dispatcher), 0)
                .takeUntil(execution -> execution.getStatus().isUnsuccessful())
                .doOnNext(execution -> {
                    if (execution.getStatus().isUnsuccessful()) {
                        log.warn("Sequential delegation {} halted at task {}: {}",
                                dispatcher.delegationId(), execution.getTaskId(), execution.getStatus());
                    }
                })
                .collectList();
    }

    static Mono<TaskExecution> runToCompletion(SubAgentTask task, TaskDispatcher dispatcher) {
        return dispatcher.assign(task)
                .flatMap(execution -> execution.getStatus().isTerminal()
                        ? Mono.just(execution)
                        : DelegationStrategyExecutor.awaitTerminal(execution.getTaskId(), dispatcher));
    }
}
