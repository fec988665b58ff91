package com.z254.butterfly.hermes.transport;

import com.z254.butterfly.hermes.domain.model.BaseMessage;
import com.z254.butterfly.hermes.domain.model.DeliveryReceipt;
import com.z254.butterfly.hermes.domain.model.RoutingTableEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transport that hands messages to handlers registered in the same JVM.
 */
@Component
@ConditionalOnProperty(prefix = "hermes.transport", name = "type", havingValue = "in-process", matchIfMissing = true)
@Slf4j
public class InProcessTransport implements MessageTransport {

    private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Register the handler receiving messages for a server, replacing any previous one.
     */
    public void register(String serverId, MessageHandler handler) {
        handlers.put(serverId, handler);
        log.info("Registered in-process handler for server {}", serverId);
    }

    public void unregister(String serverId) {
        if (handlers.remove(serverId) != null) {
            log.info("Removed in-process handler for server {}", serverId);
        }
    }

    public Set<String> registeredServers() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public Mono<DeliveryReceipt> deliver(BaseMessage message, RoutingTableEntry target) {
        MessageHandler handler = handlers.get(target.getServerId());
        if (handler == null) {
            return Mono.error(new TransportException("No in-process handler for server " + target.getServerId()));
        }
        return Mono.defer(() -> handler.handle(message))
                .map(response -> receipt(message, target, response))
                .defaultIfEmpty(receipt(message, target, Map.of()))
                .onErrorMap(e -> !(e instanceof TransportException),
                        e -> new TransportException("Handler for " + target.getServerId() + " failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<Void> probe(RoutingTableEntry target) {
        MessageHandler handler = handlers.get(target.getServerId());
        if (handler == null) {
            return Mono.error(new TransportException("No in-process handler for server " + target.getServerId()));
        }
        return Mono.defer(handler::ping);
    }

    @Override
    public String name() {
        return "in-process";
    }

    private DeliveryReceipt receipt(BaseMessage message, RoutingTableEntry target, Map<String, Object> response) {
        return DeliveryReceipt.builder()
                .serverId(target.getServerId())
                .messageId(message.messageId())
                .deliveredAt(Instant.now())
                .response(response)
                .build();
    }
}
