package com.z254.butterfly.hermes.communication;

import com.z254.butterfly.hermes.domain.model.MessageType;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of {@link CommunicationService#sendMessage}.
 * {@code body} holds whatever the handling component returned, e.g. a routing or delegation result.
 */
@Value
@Builder
public class DispatchResult {

    public enum Handler { ROUTER, SUB_AGENT_COORDINATOR, EXTERNAL_COORDINATOR }

    String messageId;

    MessageType messageType;

    String operation;

    Handler handler;

    boolean success;

    /**
     * Dispatch latency in milliseconds.
     */
    long latency;

    Object body;
}
