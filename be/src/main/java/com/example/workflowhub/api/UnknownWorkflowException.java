package com.example.workflowhub.api;

import lombok.Getter;

/**
 * Thrown when a workflow type is not registered in the definition store.
 * <p>
 * Mapped to HTTP 404 with code {@code UnknownWorkflow} by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class UnknownWorkflowException extends RuntimeException {

    private final String workflowType;

    public UnknownWorkflowException(String workflowType) {
        super("Unknown workflow: " + workflowType);
        this.workflowType = workflowType;
    }
}
