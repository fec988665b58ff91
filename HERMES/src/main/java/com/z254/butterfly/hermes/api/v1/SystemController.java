package com.z254.butterfly.hermes.api.v1;

import com.z254.butterfly.hermes.communication.CommunicationService;
import com.z254.butterfly.hermes.domain.model.SystemHealth;
import com.z254.butterfly.hermes.events.CoordinationEvent;
import com.z254.butterfly.hermes.events.CoordinationEventBus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller for system-wide health, metrics and events.
 */
@RestController
@RequestMapping("/api/v1/system")
@Tag(name = "System", description = "Health, metrics and coordination events")
public class SystemController {

    private final CommunicationService communicationService;
    private final CoordinationEventBus eventBus;

    public SystemController(CommunicationService communicationService, CoordinationEventBus eventBus) {
        this.communicationService = communicationService;
        this.eventBus = eventBus;
    }

    @GetMapping("/health")
    @Operation(summary = "System health", description = "Component health; overall is the worst component")
    public Mono<SystemHealth> health() {
        return Mono.fromCallable(communicationService::getSystemHealth);
    }

    @GetMapping("/metrics")
    @Operation(summary = "System metrics", description = "Routing, coordination, telemetry and event statistics")
    public Mono<Map<String, Object>> metrics() {
        return Mono.fromCallable(communicationService::getMetrics);
    }

    @GetMapping("/events")
    @Operation(summary = "Recent events", description = "Most recent coordination events, oldest first")
    public Mono<List<CoordinationEvent>> recentEvents(@RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> eventBus.recentEvents(limit));
    }

    @GetMapping(value = "/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Event stream", description = "Live coordination events as server-sent events")
    public Flux<CoordinationEvent> streamEvents() {
        return eventBus.subscribe();
    }
}
