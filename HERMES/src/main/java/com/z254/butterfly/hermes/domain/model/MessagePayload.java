package com.z254.butterfly.hermes.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class MessagePayload {

    Map<String, Object> data;

    String schema;

    @Builder.Default
    String encoding = "json";
}
