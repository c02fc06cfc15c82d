package com.example.workflowhub.service;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable error codes returned by the transition surface and written as audit rejection reasons.
 */
public enum TransitionErrorCode {
    NO_SUCH_TRANSITION("NoSuchTransition"),
    ACTOR_NOT_PERMITTED("ActorNotPermitted"),
    PRECONDITION_FAILED("PreconditionFailed"),
    INVALID_CREATION_STATE("InvalidCreationState"),
    WORKFLOW_TERMINATED("WorkflowTerminated"),
    CONFLICT("Conflict"),
    UNKNOWN_WORKFLOW("UnknownWorkflow"),
    UNKNOWN_STATE("UnknownState"),
    SYNC_FAILED("SyncFailed");

    private final String code;

    TransitionErrorCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Conflicts may succeed when retried from a fresh read; every other code is final for that request. */
    public boolean retryable() {
        return this == CONFLICT;
    }
}
