package com.example.workflowhub.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when the calling thread was interrupted before the version-checked write; nothing was written.
 */
@Getter
public class TransitionCancelledException extends RuntimeException {

    private final UUID entityId;

    public TransitionCancelledException(UUID entityId) {
        super("Transition cancelled before commit for entity " + entityId);
        this.entityId = entityId;
    }
}
