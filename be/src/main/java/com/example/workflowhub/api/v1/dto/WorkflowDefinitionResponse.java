package com.example.workflowhub.api.v1.dto;

import java.time.Instant;
import java.util.UUID;

/**
 * Full workflow definition response (get by type, create or update).
 */
public record WorkflowDefinitionResponse(
        UUID id,
        String workflowType,
        int definitionVersion,
        WorkflowDefinitionDto definition,
        Instant createdAt,
        Instant updatedAt
) {}
