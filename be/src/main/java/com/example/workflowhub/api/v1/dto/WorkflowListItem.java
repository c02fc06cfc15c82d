package com.example.workflowhub.api.v1.dto;

import java.time.Instant;
import java.util.UUID;

/**
 * Workflow list item (id, type, description, version, updatedAt).
 */
public record WorkflowListItem(
        UUID id,
        String workflowType,
        String description,
        int definitionVersion,
        Instant updatedAt
) {}
