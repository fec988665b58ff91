package com.z254.butterfly.hermes.delegation.strategy;

import com.z254.butterfly.hermes.domain.model.DelegationStrategyType;
import com.z254.butterfly.hermes.domain.model.SubAgentTask;
import com.z254.butterfly.hermes.domain.model.TaskExecution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Adaptive delegation.
 * Runs sequentially while the agent pool is above {@value #HIGH_LOAD} load, in parallel otherwise.
 */
@Component
@Slf4j
public class AdaptiveStrategy implements DelegationStrategyExecutor {

    static final double HIGH_LOAD = 0.8;

    private final ParallelStrategy parallel;
    private final SequentialStrategy sequential;

    public AdaptiveStrategy(ParallelStrategy parallel, SequentialStrategy sequential) {
        this.parallel = parallel;
        this.sequential = sequential;
    }

    @Override
    public DelegationStrategyType getStrategy() {
        return DelegationStrategyType.ADAPTIVE;
    }

    @Override
    public Mono<List<TaskExecution>> execute(List<SubAgentTask> tasks, TaskDispatcher dispatcher) {
        return Mono.defer(() -> {
            double load = dispatcher.systemLoad();
            DelegationStrategyExecutor chosen = load > HIGH_LOAD ? sequential : parallel;
            log.info("Adaptive delegation {} at system load {}: using {}",
                    dispatcher.delegationId(), String.format("%.2f", load), chosen.getStrategy());
            return chosen.execute(tasks, dispatcher);
        });
    }
}
