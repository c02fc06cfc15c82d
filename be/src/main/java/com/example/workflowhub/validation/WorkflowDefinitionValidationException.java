package com.example.workflowhub.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a workflow definition is rejected at load or edit time (undeclared states, duplicate edges,
 * unknown collaborators, ...).
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by {@link com.example.workflowhub.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowDefinitionValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowDefinitionValidationException(List<ValidationError> errors) {
        super("Workflow definition validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
