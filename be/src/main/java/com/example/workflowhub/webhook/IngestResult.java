package com.example.workflowhub.webhook;

import com.example.workflowhub.domain.WebhookOutcome;

import java.util.Map;

/**
 * Outcome of one webhook ingestion: accepted with the handler's result, or rejected with the logged outcome
 * and a message safe to return to the caller.
 */
public record IngestResult(WebhookOutcome outcome, Map<String, Object> result, String message) {

    public static IngestResult accepted(Map<String, Object> result) {
        return new IngestResult(WebhookOutcome.SUCCESS, result != null ? result : Map.of(), null);
    }

    public static IngestResult rejected(WebhookOutcome outcome, String message) {
        return new IngestResult(outcome, null, message);
    }

    public boolean isAccepted() {
        return outcome == WebhookOutcome.SUCCESS;
    }
}
