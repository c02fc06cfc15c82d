package com.example.workflowhub.domain;

/**
 * Result of one inbound webhook attempt, as recorded in the webhook log.
 */
public enum WebhookOutcome {
    SUCCESS,
    UNKNOWN_SOURCE,
    AUTHENTICATION_FAILURE,
    RATE_LIMITED,
    MALFORMED_PAYLOAD,
    UNSUPPORTED_EVENT,
    ERROR
}
