package com.example.workflowhub.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request body for POST /api/v1/entities. {@code state} defaults to the workflow's initial state.
 */
public record CreateEntityRequest(
        @NotBlank(message = "workflowType is required") String workflowType,
        String state,
        Map<String, Object> payload,
        String sourceSystem,
        String sourceRecordId
) {}
