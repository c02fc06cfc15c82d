package com.example.workflowhub.webhook;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Handlers by {@code (source, event_type)}. Two handlers claiming the same pair fail application startup.
 */
@Component
@Slf4j
public class WebhookHandlerRegistry {

    private final Map<HandlerKey, WebhookEventHandler> handlers;

    public WebhookHandlerRegistry(ObjectProvider<WebhookEventHandler> beans) {
        Map<HandlerKey, WebhookEventHandler> byKey = new HashMap<>();
        beans.orderedStream().forEach(handler -> {
            for (String eventType : handler.eventTypes()) {
                HandlerKey key = new HandlerKey(handler.source(), eventType);
                WebhookEventHandler previous = byKey.putIfAbsent(key, handler);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate webhook handler for source=" + key.source()
                            + " eventType=" + key.eventType() + ": " + previous.getClass().getSimpleName()
                            + " and " + handler.getClass().getSimpleName());
                }
            }
        });
        this.handlers = Map.copyOf(byKey);
        log.info("Registered {} webhook event handler route(s)", handlers.size());
    }

    public Optional<WebhookEventHandler> find(String source, String eventType) {
        if (source == null || eventType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(new HandlerKey(source, eventType)));
    }

    private record HandlerKey(String source, String eventType) {
    }
}
