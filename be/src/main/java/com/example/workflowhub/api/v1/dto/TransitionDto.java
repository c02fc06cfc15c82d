package com.example.workflowhub.api.v1.dto;

import jakarta.validation.Valid;

import java.util.List;

/**
 * One transition of a workflow definition. {@code auditRequired} defaults to true when omitted.
 */
public record TransitionDto(
        String from,
        String to,
        String trigger,
        @Valid List<PreconditionDto> preconditions,
        List<String> permittedActors,
        List<String> postActions,
        Boolean auditRequired
) {}
