package com.z254.butterfly.hermes.domain.model;

public enum TaskStatus {
    PENDING,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }

    /**
     * Terminal without a usable result.
     */
    public boolean isUnsuccessful() {
        return isTerminal() && this != COMPLETED;
    }
}
