package com.z254.butterfly.hermes.domain.model;

/**
 * Kinds of messages exchanged between servers.
 * The communication service dispatches on this value.
 */
public enum MessageType {
    COMMAND,
    EVENT,
    REQUEST,
    RESPONSE,
    BROADCAST,
    WAVE_COORDINATION,
    PERSONA_CHAIN,
    QUALITY_GATE,
    SUB_AGENT_DELEGATION
}
