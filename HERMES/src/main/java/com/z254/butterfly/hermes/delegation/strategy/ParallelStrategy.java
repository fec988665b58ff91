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
 * Parallel delegation.
 * All tasks are assigned immediately; the delegation finishes once every execution is terminal.
 */
@Component
@Slf4j
public class ParallelStrategy implements DelegationStrategyExecutor {

    @Override
    public DelegationStrategyType getStrategy() {
        return DelegationStrategyType.PARALLEL;
    }

    @Override
    public Mono<List<TaskExecution>> execute(List<SubAgentTask> tasks, TaskDispatcher dispatcher) {
        log.info("Executing parallel delegation {} with {} tasks", dispatcher.delegationId(), tasks.size());

        return Flux.fromIterable(tasks)
                .flatMapSequential(dispatcher::assign)
                .map(TaskExecution::getTaskId)
                .collectList()
                .flatMap(taskIds -> DelegationStrategyExecutor.awaitAll(taskIds, dispatcher));
    }
}
