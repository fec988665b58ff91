package com.z254.butterfly.hermes.delegation.strategy;

import com.z254.butterfly.hermes.domain.model.DelegationStrategyType;
import com.z254.butterfly.hermes.domain.model.SubAgentTask;
import com.z254.butterfly.hermes.domain.model.TaskExecution;
import com.z254.butterfly.hermes.domain.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pipeline delegation.
 * Tasks run in order and every task after the first receives the previous task's result under
 * {@value #PIPELINE_INPUT}. A task that does not complete stops the pipeline.
 */
@Component
@Slf4j
public class PipelineStrategy implements DelegationStrategyExecutor {

    public static final String PIPELINE_INPUT = "pipelineInput";

    @Override
    public DelegationStrategyType getStrategy() {
        return DelegationStrategyType.PIPELINE;
    }

    @Override
    public Mono<List<TaskExecution>> execute(List<SubAgentTask> tasks, TaskDispatcher dispatcher) {
        log.info("Executing pipeline delegation {} with {} stages", dispatcher.delegationId(), tasks.size());
        AtomicReference<Map<String, Object>> previousResult = new AtomicReference<>();

        return Flux.fromIterable(tasks)
                .concatMap(task -> SequentialStrategy.runToCompletion(withPipelineInput(task, previousResult.get()), dispatcher), 0)
                .doOnNext(execution -> previousResult.set(execution.getResult()))
                .takeUntil(execution -> execution.getStatus() != TaskStatus.COMPLETED)
                .doOnNext(execution -> {
                    if (execution.getStatus() != TaskStatus.COMPLETED) {
                        log.warn("Pipeline {} halted at stage {}: {}",
                                dispatcher.delegationId(), execution.getTaskId(), execution.getStatus());
                    }
                })
                .collectList();
    }

    private SubAgentTask withPipelineInput(SubAgentTask task, Map<String, Object> previous) {
        if (previous == null) {
            return task;
        }
        Map<String, Object> input = new LinkedHashMap<>();
        if (task.getInput() != null) {
            input.putAll(task.getInput());
        }
        input.put(PIPELINE_INPUT, previous);
        return task.toBuilder().input(input).build();
    }
}
