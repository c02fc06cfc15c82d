package com.example.workflowhub.service;

import java.util.UUID;

/**
 * Result of a transition or creation request: the entity as written, or the reason nothing was written.
 */
public record TransitionResult(EntitySnapshot entity, TransitionError error, UUID correlationId) {

    public static TransitionResult applied(EntitySnapshot entity, UUID correlationId) {
        return new TransitionResult(entity, null, correlationId);
    }

    public static TransitionResult rejected(TransitionErrorCode code, String message, UUID correlationId) {
        return new TransitionResult(null, new TransitionError(code, message), correlationId);
    }

    public boolean isApplied() {
        return error == null;
    }
}
