package com.example.workflowhub.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /api/v1/entities/{id}/transitions.
 */
public record TransitionRequest(
        @NotBlank(message = "toState is required") String toState,
        String triggerEvent
) {}
