package com.z254.butterfly.hermes.communication;

import com.z254.butterfly.hermes.domain.model.BaseMessage;
import com.z254.butterfly.hermes.domain.model.MessageType;
import reactor.core.publisher.Mono;

/**
 * Higher-level coordinator (wave, persona chain, quality gate) that the communication service
 * hands messages to once the matching orchestration feature is enabled.
 * Implementations are discovered as Spring beans.
 */
public interface ExternalCoordinator {

    String name();

    boolean supports(MessageType messageType);

    Mono<Object> handle(BaseMessage message);
}
