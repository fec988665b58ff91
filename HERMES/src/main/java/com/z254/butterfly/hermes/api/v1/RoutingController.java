package com.z254.butterfly.hermes.api.v1;

import com.z254.butterfly.hermes.domain.model.*;
import com.z254.butterfly.hermes.routing.MessageRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the routing table and circuit breakers.
 */
@RestController
@RequestMapping("/api/v1/routing")
@Tag(name = "Routing", description = "Routing table, server health and circuit breakers")
@Slf4j
public class RoutingController {

    private final MessageRouter router;

    public RoutingController(MessageRouter router) {
        this.router = router;
    }

    @GetMapping("/servers")
    @Operation(summary = "Routing table")
    public Mono<List<RoutingTableEntry>> servers() {
        return Mono.fromCallable(router::getRoutingTable);
    }

    @PutMapping("/servers")
    @Operation(summary = "Update routing table", description = "Apply add, update and remove actions")
    @ApiResponse(responseCode = "204", description = "Updates applied")
    @ApiResponse(responseCode = "400", description = "Malformed update")
    public Mono<ResponseEntity<Void>> update(@RequestBody List<RoutingTableUpdate> updates) {
        log.info("Applying {} routing table updates", updates.size());

        return Mono.fromRunnable(() -> router.updateRoutingTable(updates))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()))
                .onErrorMap(ApiErrors::toResponseStatus);
    }

    @PostMapping("/servers/{id}/health-check")
    @Operation(summary = "Check server health", description = "Probe a server and store its health")
    @ApiResponse(responseCode = "404", description = "Unknown server")
    public Mono<HealthStatus> healthCheck(@PathVariable String id) {
        return router.checkServerHealth(id)
                .onErrorMap(ApiErrors::toResponseStatus);
    }

    @PostMapping("/route")
    @Operation(summary = "Preview route", description = "Compute the route a message would take without sending it")
    public Mono<Route> preview(@RequestBody BaseMessage message) {
        return router.calculateOptimalRoute(message)
                .onErrorMap(ApiErrors::toResponseStatus);
    }

    @GetMapping("/metrics")
    @Operation(summary = "Routing metrics")
    public Mono<RoutingMetrics> metrics() {
        return Mono.fromCallable(router::getRoutingMetrics);
    }

    @GetMapping("/circuit-breakers")
    @Operation(summary = "Circuit breaker states")
    public Mono<Map<String, CircuitBreakerState>> circuitBreakers() {
        return Mono.fromCallable(router::getCircuitBreakerStates);
    }
}
