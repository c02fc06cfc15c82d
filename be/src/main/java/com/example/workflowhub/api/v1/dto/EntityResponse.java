package com.example.workflowhub.api.v1.dto;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * An entity as stored. {@code correlationId} is set on responses to create and transition requests.
 */
public record EntityResponse(
        UUID id,
        String workflowType,
        String state,
        long version,
        Map<String, Object> payload,
        String sourceSystem,
        String sourceRecordId,
        Instant updatedAt,
        UUID correlationId
) {}
