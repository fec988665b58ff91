package com.z254.butterfly.hermes.domain.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
