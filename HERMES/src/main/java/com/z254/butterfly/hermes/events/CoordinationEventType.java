package com.z254.butterfly.hermes.events;

public enum CoordinationEventType {
    ROUTING_TABLE_UPDATED,
    SERVER_HEALTH_CHANGED,
    CIRCUIT_STATE_CHANGED,
    FAILOVER,
    AGENT_REGISTERED,
    AGENT_UNREGISTERED,
    AGENT_HEALTH_ISSUE,
    TASK_ASSIGNED,
    TASK_REASSIGNED,
    TASK_TIMEOUT,
    DELEGATION_COMPLETED,
    DELEGATION_FAILED,
    SCALING_RECOMMENDED,
    PERFORMANCE_ALERT
}
