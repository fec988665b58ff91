package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Acknowledgement returned by a transport after a successful delivery.
 */
@Value
@Builder
public class DeliveryReceipt {
    String serverId;
    String messageId;
    Instant deliveredAt;
    Map<String, Object> response;
}
