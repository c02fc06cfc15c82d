package com.example.workflowhub.api.v1.dto;

import java.time.Instant;
import java.util.UUID;

public record AuditRecordResponse(
        Long id,
        UUID entityId,
        String workflowType,
        String fromState,
        String toState,
        String actor,
        String triggerEvent,
        UUID correlationId,
        String outcome,
        String reason,
        String detail,
        Instant recordedAt
) {}
