package com.z254.butterfly.hermes.domain.model;

/**
 * How the tasks of a delegation are distributed over agents.
 */
public enum DelegationStrategyType {
    /** Assign all tasks at once and wait for all of them. */
    PARALLEL,
    /** One task at a time, stopping at the first unsuccessful one. */
    SEQUENTIAL,
    /** Sequential, feeding each result into the next task's input. */
    PIPELINE,
    /** Sequential under high system load, parallel otherwise. */
    ADAPTIVE
}
