package com.example.workflowhub.validation;

import java.util.Objects;

/**
 * A single validation error (field path and message).
 */
public record ValidationError(String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
