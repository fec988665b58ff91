package com.z254.butterfly.hermes.transport;

import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.domain.model.BaseMessage;
import com.z254.butterfly.hermes.domain.model.DeliveryReceipt;
import com.z254.butterfly.hermes.domain.model.RoutingTableEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

/**
 * Transport that POSTs JSON messages to the first endpoint of the target server.
 */
@Component
@ConditionalOnProperty(prefix = "hermes.transport", name = "type", havingValue = "http")
@Slf4j
public class HttpMessageTransport implements MessageTransport {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final HermesProperties.TransportProperties.HttpProperties httpProperties;

    public HttpMessageTransport(WebClient.Builder webClientBuilder, HermesProperties hermesProperties) {
        this.webClient = webClientBuilder.build();
        this.httpProperties = hermesProperties.getTransport().getHttp();
    }

    @Override
    public Mono<DeliveryReceipt> deliver(BaseMessage message, RoutingTableEntry target) {
        String baseUrl = baseUrl(target);
        if (baseUrl == null) {
            return Mono.error(new TransportException("Server " + target.getServerId() + " has no endpoint"));
        }

        return webClient.post()
                .uri(baseUrl + httpProperties.getInboundPath())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(message)
                .retrieve()
                .bodyToMono(RESPONSE_TYPE)
                .defaultIfEmpty(Map.of())
                .map(response -> DeliveryReceipt.builder()
                        .serverId(target.getServerId())
                        .messageId(message.messageId())
                        .deliveredAt(Instant.now())
                        .response(response)
                        .build())
                .doOnError(error -> log.debug("HTTP delivery of {} to {} failed: {}",
                        message.messageId(), target.getServerId(), error.getMessage()))
                .onErrorMap(e -> !(e instanceof TransportException),
                        e -> new TransportException("HTTP delivery to " + target.getServerId() + " failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<Void> probe(RoutingTableEntry target) {
        String baseUrl = baseUrl(target);
        if (baseUrl == null) {
            return Mono.error(new TransportException("Server " + target.getServerId() + " has no endpoint"));
        }
        return webClient.get()
                .uri(baseUrl + httpProperties.getHealthPath())
                .retrieve()
                .toBodilessEntity()
                .then();
    }

    @Override
    public String name() {
        return "http";
    }

    private String baseUrl(RoutingTableEntry target) {
        if (target.getEndpoints() == null || target.getEndpoints().isEmpty()) {
            return null;
        }
        String endpoint = target.getEndpoints().get(0);
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
