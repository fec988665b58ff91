package com.z254.butterfly.hermes.events;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Notification published by the router, coordinator and communication service.
 */
@Value
@Builder
public class CoordinationEvent {

    String eventId;

    CoordinationEventType type;

    /**
     * Component that raised the event.
     */
    String source;

    /**
     * Id of the server, agent, task or delegation the event is about.
     */
    String subjectId;

    Map<String, Object> attributes;

    Instant timestamp;

    public static CoordinationEvent of(CoordinationEventType type, String source, String subjectId,
                                       Map<String, Object> attributes) {
        return CoordinationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .source(source)
                .subjectId(subjectId)
                .attributes(attributes != null ? attributes : Map.of())
                .timestamp(Instant.now())
                .build();
    }
}
