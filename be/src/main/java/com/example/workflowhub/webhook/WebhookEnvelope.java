package com.example.workflowhub.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of every inbound webhook: {@code {"source": ..., "event_type": ..., "payload": {...}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookEnvelope(
        String source,
        @JsonProperty("event_type") String eventType,
        Map<String, Object> payload
) {}
