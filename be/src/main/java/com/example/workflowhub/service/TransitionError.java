package com.example.workflowhub.service;

import java.util.Objects;

public record TransitionError(TransitionErrorCode code, String message) {

    public TransitionError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }
}
