package com.example.workflowhub.webhook;

/**
 * Thrown by handlers when an authenticated event lacks a required field or carries an invalid value.
 */
public class MalformedWebhookPayloadException extends RuntimeException {

    public MalformedWebhookPayloadException(String message) {
        super(message);
    }
}
