package com.z254.butterfly.hermes.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for HERMES service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Message routing (delivered, failed, failovers, latency)</li>
 *     <li>Sub-agent tasks (assigned, completed, failed, timed out)</li>
 *     <li>Delegations (completed, failed, duration)</li>
 *     <li>Communication dispatch (latency per message type, errors)</li>
 * </ul>
 */
@Component
public class HermesMetrics {

    private final MeterRegistry meterRegistry;

    // Routing metrics
    @Getter
    private final Counter messagesRouted;
    @Getter
    private final Counter messagesFailed;
    @Getter
    private final Counter failovers;
    private final Timer routingLatency;
    private final Map<String, Counter> deliveriesByServer = new ConcurrentHashMap<>();

    // Task metrics
    @Getter
    private final Counter tasksAssigned;
    @Getter
    private final Counter tasksUnassignable;
    @Getter
    private final Counter tasksCompleted;
    @Getter
    private final Counter tasksFailed;
    @Getter
    private final Counter tasksTimedOut;
    private final Timer taskDuration;
    private final AtomicInteger activeTasks;
    private final AtomicInteger registeredAgents;

    // Delegation metrics
    @Getter
    private final Counter delegationsCompleted;
    @Getter
    private final Counter delegationsFailed;
    private final Timer delegationDuration;
    private final DistributionSummary delegationSize;

    // Dispatch metrics
    private final Map<String, Timer> dispatchLatencyByType = new ConcurrentHashMap<>();
    private final Map<String, Counter> dispatchErrorsByType = new ConcurrentHashMap<>();

    public HermesMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.messagesRouted = Counter.builder("hermes.routing.messages")
                .description("Messages delivered by the router")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.messagesFailed = Counter.builder("hermes.routing.messages")
                .description("Messages the router failed to deliver")
                .tag("outcome", "failure")
                .register(meterRegistry);
        this.failovers = Counter.builder("hermes.routing.failovers")
                .description("Messages redirected to a failover server")
                .register(meterRegistry);
        this.routingLatency = Timer.builder("hermes.routing.latency")
                .description("Delivery latency of routed messages")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.tasksAssigned = Counter.builder("hermes.tasks.assigned")
                .description("Sub-agent tasks assigned to an agent")
                .register(meterRegistry);
        this.tasksUnassignable = Counter.builder("hermes.tasks.unassignable")
                .description("Sub-agent tasks no agent could take")
                .register(meterRegistry);
        this.tasksCompleted = Counter.builder("hermes.tasks.completed")
                .description("Sub-agent tasks completed")
                .register(meterRegistry);
        this.tasksFailed = Counter.builder("hermes.tasks.failed")
                .description("Sub-agent tasks failed")
                .register(meterRegistry);
        this.tasksTimedOut = Counter.builder("hermes.tasks.timeout")
                .description("Sub-agent tasks that timed out")
                .register(meterRegistry);
        this.taskDuration = Timer.builder("hermes.tasks.duration")
                .description("Time from assignment to completion")
                .register(meterRegistry);
        this.activeTasks = new AtomicInteger(0);
        Gauge.builder("hermes.tasks.active", activeTasks, AtomicInteger::get)
                .description("Tasks currently held by agents")
                .register(meterRegistry);
        this.registeredAgents = new AtomicInteger(0);
        Gauge.builder("hermes.agents.registered", registeredAgents, AtomicInteger::get)
                .description("Registered sub-agents")
                .register(meterRegistry);

        this.delegationsCompleted = Counter.builder("hermes.delegations")
                .description("Delegations that produced an aggregated result")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.delegationsFailed = Counter.builder("hermes.delegations")
                .description("Delegations without an aggregated result")
                .tag("outcome", "failure")
                .register(meterRegistry);
        this.delegationDuration = Timer.builder("hermes.delegations.duration")
                .description("Wall-clock duration of delegations")
                .register(meterRegistry);
        this.delegationSize = DistributionSummary.builder("hermes.delegations.size")
                .description("Number of tasks per delegation")
                .register(meterRegistry);
    }

    // Routing

    public void recordDelivery(String serverId, Duration latency, boolean success) {
        if (success) {
            messagesRouted.increment();
            deliveriesByServer.computeIfAbsent(serverId, id -> Counter.builder("hermes.routing.deliveries")
                    .description("Messages delivered per server")
                    .tag("server", id)
                    .register(meterRegistry)).increment();
        } else {
            messagesFailed.increment();
        }
        routingLatency.record(latency);
    }

    public void recordFailover() {
        failovers.increment();
    }

    // Tasks

    public void recordTaskAssigned() {
        tasksAssigned.increment();
    }

    public void recordTaskUnassignable() {
        tasksUnassignable.increment();
    }

    public void recordTaskCompleted(Duration duration) {
        tasksCompleted.increment();
        if (duration != null) {
            taskDuration.record(duration);
        }
    }

    public void recordTaskFailed() {
        tasksFailed.increment();
    }

    public void recordTaskTimeout() {
        tasksTimedOut.increment();
    }

    public void setActiveTasks(int count) {
        activeTasks.set(count);
    }

    public void setRegisteredAgents(int count) {
        registeredAgents.set(count);
    }

    // Delegations

    public void recordDelegation(boolean success, int taskCount, Duration duration) {
        if (success) {
            delegationsCompleted.increment();
        } else {
            delegationsFailed.increment();
        }
        delegationSize.record(taskCount);
        delegationDuration.record(duration);
    }

    // Dispatch

    public void recordDispatch(String messageType, Duration latency) {
        dispatchLatencyByType.computeIfAbsent(messageType, type -> Timer.builder("hermes.dispatch.latency")
                .description("Communication service dispatch latency")
                .tag("type", type)
                .register(meterRegistry)).record(latency);
    }

    public void recordDispatchError(String messageType) {
        dispatchErrorsByType.computeIfAbsent(messageType, type -> Counter.builder("hermes.dispatch.errors")
                .description("Communication service dispatch errors")
                .tag("type", type)
                .register(meterRegistry)).increment();
    }
}
