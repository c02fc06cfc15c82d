package com.example.workflowhub.sync;

/**
 * Thrown when the external system of record rejects or cannot receive an entity update.
 */
public class ExternalSyncException extends RuntimeException {

    public ExternalSyncException(String message) {
        super(message);
    }

    public ExternalSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
