package com.example.workflowhub.api.v1.dto;

import java.util.Map;

/**
 * Response for POST /webhooks/{source}: the handler result on success, a generic error otherwise.
 */
public record WebhookResponse(boolean success, Map<String, Object> result, String error) {

    public static WebhookResponse ok(Map<String, Object> result) {
        return new WebhookResponse(true, result, null);
    }

    public static WebhookResponse failed(String error) {
        return new WebhookResponse(false, null, error);
    }
}
