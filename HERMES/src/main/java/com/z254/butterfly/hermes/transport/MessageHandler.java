package com.z254.butterfly.hermes.transport;

import com.z254.butterfly.hermes.domain.model.BaseMessage;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Receiver of messages delivered in-process.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handle a delivered message. An error signal counts as a failed delivery.
     *
     * @return Optional response data
     */
    Mono<Map<String, Object>> handle(BaseMessage message);

    /**
     * Answer a health probe.
     */
    default Mono<Void> ping() {
        return Mono.empty();
    }
}
