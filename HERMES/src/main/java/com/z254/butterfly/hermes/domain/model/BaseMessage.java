package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Envelope for every message handled by HERMES.
 * Instances are immutable; broadcast fan-out derives per-target copies with {@link #withTarget(String)}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BaseMessage {

    MessageHeader header;

    MessagePayload payload;

    MessageMetadata metadata;

    /**
     * Copy of this message addressed to another server.
     */
    public BaseMessage withTarget(String target) {
        return toBuilder()
                .header(header.toBuilder().target(target).build())
                .build();
    }

    public String messageId() {
        return header != null ? header.getMessageId() : null;
    }

    public String target() {
        return header != null ? header.getTarget() : null;
    }

    public MessagePriority priority() {
        return header != null && header.getPriority() != null ? header.getPriority() : MessagePriority.NORMAL;
    }

    /**
     * Payload data, never null.
     */
    public Map<String, Object> data() {
        return payload != null && payload.getData() != null ? payload.getData() : Map.of();
    }

    public String routingHint(String key) {
        if (metadata == null || metadata.getRoutingHints() == null) {
            return null;
        }
        return metadata.getRoutingHints().get(key);
    }

    /**
     * Create a message with a generated id and the current timestamp.
     */
    public static BaseMessage create(String source, String target, String operation,
                                     MessageType type, Map<String, Object> data) {
        return BaseMessage.builder()
                .header(MessageHeader.builder()
                        .messageId(UUID.randomUUID().toString())
                        .source(source)
                        .target(target)
                        .operation(operation)
                        .messageType(type)
                        .timestamp(Instant.now())
                        .build())
                .payload(MessagePayload.builder().data(data).build())
                .metadata(MessageMetadata.builder().build())
                .build();
    }
}
