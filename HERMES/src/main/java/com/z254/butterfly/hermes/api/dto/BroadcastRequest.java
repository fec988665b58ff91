package com.z254.butterfly.hermes.api.dto;

import com.z254.butterfly.hermes.domain.model.BaseMessage;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for broadcasting a message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastRequest {

    @NotNull(message = "Message is required")
    private BaseMessage message;

    /**
     * Target servers; empty means every server in the routing table.
     */
    private List<String> targets;
}
