package com.z254.butterfly.hermes.domain.model;

public enum ScalingAction {
    SCALE_UP,
    SCALE_DOWN,
    MAINTAIN
}
