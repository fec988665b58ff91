package com.z254.butterfly.hermes.transport;

import com.z254.butterfly.hermes.domain.model.BaseMessage;
import com.z254.butterfly.hermes.domain.model.DeliveryReceipt;
import com.z254.butterfly.hermes.domain.model.RoutingTableEntry;
import reactor.core.publisher.Mono;

/**
 * Outbound delivery channel used by the router.
 * One call to {@link #deliver} is made per routed message.
 */
public interface MessageTransport {

    /**
     * Deliver a message to the given server.
     *
     * @param message The message, already addressed to {@code target}
     * @param target  Routing record of the receiving server
     * @return Receipt on success, or an error signal when delivery failed
     */
    Mono<DeliveryReceipt> deliver(BaseMessage message, RoutingTableEntry target);

    /**
     * Lightweight liveness probe. Completes empty when the server answered.
     */
    Mono<Void> probe(RoutingTableEntry target);

    String name();

    /**
     * Raised when a message could not be handed to the target server.
     */
    class TransportException extends RuntimeException {
        public TransportException(String message) {
            super(message);
        }

        public TransportException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
