package com.z254.butterfly.hermes.domain.model;

/**
 * Health classification shared by servers, components and the overall system.
 */
public enum HealthState {
    HEALTHY(100),
    DEGRADED(50),
    UNHEALTHY(0);

    private final int scoreBonus;

    HealthState(int scoreBonus) {
        this.scoreBonus = scoreBonus;
    }

    /**
     * Bonus used by performance-weighted load balancing.
     */
    public int scoreBonus() {
        return scoreBonus;
    }

    /**
     * The worse of two states.
     */
    public HealthState worst(HealthState other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
