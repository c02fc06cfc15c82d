package com.example.workflowhub.webhook;

import java.util.Map;
import java.util.Set;

/**
 * Handles the events of one webhook source. Implementations are Spring beans collected by
 * {@link WebhookHandlerRegistry}.
 */
public interface WebhookEventHandler {

    String source();

    Set<String> eventTypes();

    /**
     * Processes one event and returns the result echoed to the caller.
     *
     * @throws MalformedWebhookPayloadException when required payload fields are missing or invalid
     */
    Map<String, Object> handle(WebhookEvent event);
}
