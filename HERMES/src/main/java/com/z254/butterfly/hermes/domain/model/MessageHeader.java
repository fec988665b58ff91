package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Addressing and classification fields of a {@link BaseMessage}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MessageHeader {

    String messageId;

    String correlationId;

    String source;

    /**
     * Target server id. {@code *} or blank lets the router pick via load balancing.
     */
    String target;

    String operation;

    MessageType messageType;

    @Builder.Default
    MessagePriority priority = MessagePriority.NORMAL;

    Instant timestamp;
}
