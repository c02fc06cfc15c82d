package com.example.workflowhub.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when an entity is not found by id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class EntityNotFoundException extends RuntimeException {

    private final UUID entityId;

    public EntityNotFoundException(UUID entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }
}
