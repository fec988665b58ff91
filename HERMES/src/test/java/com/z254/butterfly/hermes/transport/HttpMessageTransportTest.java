package com.z254.butterfly.hermes.transport;

import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.domain.model.BaseMessage;
import com.z254.butterfly.hermes.domain.model.MessageType;
import com.z254.butterfly.hermes.domain.model.RoutingTableEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for HttpMessageTransport, with a stubbed exchange function in place of a server.
 */
class HttpMessageTransportTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private HermesProperties properties;

    @BeforeEach
    void setUp() {
        properties = new HermesProperties();
        properties.getTransport().setType("http");
    }

    @Test
    void shouldPostMessageToInboundPathOfFirstEndpoint() {
        // Given
        HttpMessageTransport transport = transportAnswering(HttpStatus.OK, "{\"accepted\":true}");
        BaseMessage message = BaseMessage.create("client", "s1", "process", MessageType.COMMAND, Map.of());

        // When
        StepVerifier.create(transport.deliver(message, entry("s1", "http://s1.local:8080/", "http://backup")))
                .assertNext(receipt -> {
                    assertThat(receipt.getServerId()).isEqualTo("s1");
                    assertThat(receipt.getMessageId()).isEqualTo(message.messageId());
                    assertThat(receipt.getResponse()).containsEntry("accepted", true);
                })
                .verifyComplete();

        // Then
        ClientRequest request = lastRequest.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("http://s1.local:8080/api/v1/messages/inbound");
    }

    @Test
    void shouldWrapHttpErrorsInTransportException() {
        // Given
        HttpMessageTransport transport = transportAnswering(HttpStatus.INTERNAL_SERVER_ERROR, "{}");
        BaseMessage message = BaseMessage.create("client", "s1", "process", MessageType.COMMAND, Map.of());

        // Then
        StepVerifier.create(transport.deliver(message, entry("s1", "http://s1.local")))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(MessageTransport.TransportException.class)
                        .hasMessageStartingWith("HTTP delivery to s1 failed"))
                .verify();
    }

    @Test
    void shouldFailForServerWithoutEndpoint() {
        // Given
        HttpMessageTransport transport = transportAnswering(HttpStatus.OK, "{}");

        // Then
        StepVerifier.create(transport.probe(entry("s1")))
                .expectErrorMessage("Server s1 has no endpoint")
                .verify();
        assertThat(lastRequest.get()).isNull();
    }

    @Test
    void shouldProbeHealthPath() {
        // Given
        HttpMessageTransport transport = transportAnswering(HttpStatus.OK, "{\"status\":\"UP\"}");

        // Then
        StepVerifier.create(transport.probe(entry("s1", "http://s1.local")))
                .verifyComplete();
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.GET);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/actuator/health");
    }

    private HttpMessageTransport transportAnswering(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new HttpMessageTransport(builder, properties);
    }

    private RoutingTableEntry entry(String serverId, String... endpoints) {
        RoutingTableEntry entry = RoutingTableEntry.builder().serverId(serverId).build();
        entry.getEndpoints().addAll(List.of(endpoints));
        return entry;
    }
}
