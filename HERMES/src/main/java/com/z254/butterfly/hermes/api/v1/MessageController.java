package com.z254.butterfly.hermes.api.v1;

import com.z254.butterfly.hermes.api.dto.BroadcastRequest;
import com.z254.butterfly.hermes.communication.CommunicationService;
import com.z254.butterfly.hermes.communication.DispatchResult;
import com.z254.butterfly.hermes.domain.model.BaseMessage;
import com.z254.butterfly.hermes.domain.model.BroadcastResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST controller for sending and broadcasting messages.
 */
@RestController
@RequestMapping("/api/v1/messages")
@Tag(name = "Messages", description = "Message dispatch and broadcast")
@Slf4j
public class MessageController {

    private final CommunicationService communicationService;

    public MessageController(CommunicationService communicationService) {
        this.communicationService = communicationService;
    }

    @PostMapping
    @Operation(summary = "Send message", description = "Dispatch a message by its type to the router or a coordinator")
    @ApiResponse(responseCode = "200", description = "Message dispatched")
    @ApiResponse(responseCode = "400", description = "Malformed message")
    @ApiResponse(responseCode = "503", description = "Service stopped or feature disabled")
    public Mono<ResponseEntity<DispatchResult>> sendMessage(@RequestBody BaseMessage message) {
        log.debug("Received message {}", message.messageId());

        return communicationService.sendMessage(message)
                .map(ResponseEntity::ok)
                .onErrorMap(ApiErrors::toResponseStatus);
    }

    @PostMapping("/broadcast")
    @Operation(summary = "Broadcast message", description = "Deliver a copy of a message to several servers")
    @ApiResponse(responseCode = "200", description = "Broadcast attempted; see per-target results")
    public Mono<ResponseEntity<BroadcastResult>> broadcast(@Valid @RequestBody BroadcastRequest request) {
        return communicationService.broadcastMessage(request.getMessage(), request.getTargets())
                .map(ResponseEntity::ok)
                .onErrorMap(ApiErrors::toResponseStatus);
    }
}
