package com.example.workflowhub.webhook.handler;

import com.example.workflowhub.service.EntityStateService;
import com.example.workflowhub.service.TransitionResult;
import com.example.workflowhub.webhook.MalformedWebhookPayloadException;
import com.example.workflowhub.webhook.WebhookEvent;
import com.example.workflowhub.webhook.WebhookEventHandler;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * State changes requested by the API gateway: {@code workflow_state_change} with {@code entity_id},
 * {@code to_state} and an optional {@code trigger}.
 */
@Component
@RequiredArgsConstructor
public class ApiGatewayWebhookHandler implements WebhookEventHandler {

    public static final String SOURCE = "api_gateway";
    static final String WORKFLOW_STATE_CHANGE = "workflow_state_change";

    private final EntityStateService entityStateService;

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(WORKFLOW_STATE_CHANGE);
    }

    @Override
    public Map<String, Object> handle(WebhookEvent event) {
        UUID entityId = parseEntityId(WebhookPayloads.requireText(event.payload(), "entity_id"));
        String toState = WebhookPayloads.requireText(event.payload(), "to_state");
        String trigger = WebhookPayloads.optionalText(event.payload(), "trigger");
        TransitionResult result = entityStateService.transition(entityId, toState, event.actor(),
                trigger != null ? trigger : SOURCE + "." + WORKFLOW_STATE_CHANGE);
        return WebhookPayloads.toResult(result);
    }

    private static UUID parseEntityId(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedWebhookPayloadException("entity_id is not a UUID: " + value);
        }
    }
}
