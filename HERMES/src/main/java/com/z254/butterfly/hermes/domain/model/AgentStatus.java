package com.z254.butterfly.hermes.domain.model;

/**
 * Lifecycle status of a sub-agent.
 */
public enum AgentStatus {
    AVAILABLE,
    BUSY,
    OVERLOADED,
    OFFLINE,
    ERROR;

    /**
     * Whether an agent in this status may receive new tasks, capacity permitting.
     */
    public boolean acceptsWork() {
        return this == AVAILABLE || this == BUSY;
    }
}
