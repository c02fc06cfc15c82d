package com.example.workflowhub.api;

import lombok.Getter;

/**
 * Thrown when a state is not declared by the workflow it is used with.
 */
@Getter
public class UnknownStateException extends RuntimeException {

    private final String workflowType;
    private final String state;

    public UnknownStateException(String workflowType, String state) {
        super("Unknown state '" + state + "' for workflow " + workflowType);
        this.workflowType = workflowType;
        this.state = state;
    }
}
