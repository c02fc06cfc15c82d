package com.example.workflowhub.api.v1.dto;

import java.time.Instant;

public record WebhookLogResponse(
        Long id,
        String source,
        String eventType,
        String caller,
        String outcome,
        String payloadDigest,
        int payloadSize,
        String errorMessage,
        Instant receivedAt
) {}
