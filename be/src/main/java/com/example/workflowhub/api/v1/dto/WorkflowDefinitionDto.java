package com.example.workflowhub.api.v1.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * Workflow definition as configured on the classpath and edited through the admin API.
 * <p>
 * {@code notificationTargets} maps a state to the collaborators informed when an entity enters it.
 * </p>
 */
public record WorkflowDefinitionDto(
        @NotBlank String workflowType,
        String description,
        @NotEmpty List<String> states,
        @NotBlank String initialState,
        List<String> terminalStates,
        @Valid List<TransitionDto> transitions,
        Map<String, List<String>> notificationTargets
) {}
