package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Map;

/**
 * Delivery metadata carried alongside a message.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MessageMetadata {

    /**
     * Time to live. Also used as the delivery deadline for delegated tasks.
     */
    Duration ttl;

    int retryCount;

    /**
     * Free-form hints for the router, e.g. {@code capability} or {@code sub_agent_task}.
     */
    @Singular
    Map<String, String> routingHints;
}
