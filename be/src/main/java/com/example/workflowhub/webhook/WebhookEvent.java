package com.example.workflowhub.webhook;

import com.example.workflowhub.security.Actor;

import java.util.Map;

/**
 * An authenticated, parsed webhook handed to a {@link WebhookEventHandler}.
 *
 * @param actor the source's system actor; handlers act with this identity only
 */
public record WebhookEvent(String source, String eventType, Map<String, Object> payload, Actor actor, String caller) {

    public WebhookEvent {
        payload = payload != null ? payload : Map.of();
    }
}
