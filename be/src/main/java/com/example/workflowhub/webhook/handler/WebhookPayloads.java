package com.example.workflowhub.webhook.handler;

import com.example.workflowhub.service.TransitionResult;
import com.example.workflowhub.webhook.MalformedWebhookPayloadException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field access and result shaping shared by the webhook handlers.
 */
final class WebhookPayloads {

    private WebhookPayloads() {
    }

    static String requireText(Map<String, Object> payload, String field) {
        String value = optionalText(payload, field);
        if (value == null) {
            throw new MalformedWebhookPayloadException("Missing required field: " + field);
        }
        return value;
    }

    static String optionalText(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> optionalObject(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new MalformedWebhookPayloadException("Field must be an object: " + field);
        }
        return (Map<String, Object>) value;
    }

    /**
     * Result echoed to the webhook caller. A rejected transition is a processed event, reported with its code.
     */
    static Map<String, Object> toResult(TransitionResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("applied", result.isApplied());
        body.put("correlationId", result.correlationId().toString());
        if (result.isApplied()) {
            body.put("entityId", result.entity().id().toString());
            body.put("state", result.entity().state());
            body.put("version", result.entity().version());
        } else {
            body.put("code", result.error().code().code());
            body.put("message", result.error().message());
        }
        return body;
    }
}
