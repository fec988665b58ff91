package com.z254.butterfly.hermes.delegation.strategy;

import com.z254.butterfly.hermes.domain.model.SubAgentTask;
import com.z254.butterfly.hermes.domain.model.TaskExecution;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Operations a delegation strategy needs from the coordinator, scoped to one delegation.
 */
public interface TaskDispatcher {

    String delegationId();

    /**
     * Assign and dispatch a task. Never errors; failures come back as failed executions.
     */
    Mono<TaskExecution> assign(SubAgentTask task);

    /**
     * Latest execution of a task, after applying its timeout.
     */
    TaskExecution refresh(String taskId);

    Duration pollInterval();

    /**
     * Active tasks over total agent capacity, 0..1.
     */
    double systemLoad();
}
