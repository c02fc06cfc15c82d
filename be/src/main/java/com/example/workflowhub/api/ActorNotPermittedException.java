package com.example.workflowhub.api;

/**
 * Thrown when an authenticated actor calls an operation its roles do not allow (administrative endpoints).
 */
public class ActorNotPermittedException extends RuntimeException {

    public ActorNotPermittedException(String message) {
        super(message);
    }
}
