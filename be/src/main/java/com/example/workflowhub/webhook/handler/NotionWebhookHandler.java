package com.example.workflowhub.webhook.handler;

import com.example.workflowhub.service.EntitySnapshot;
import com.example.workflowhub.service.EntityStateService;
import com.example.workflowhub.service.TransitionResult;
import com.example.workflowhub.webhook.WebhookEvent;
import com.example.workflowhub.webhook.WebhookEventHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Notion database pages linked to workflow entities.
 * <p>
 * {@code page.created} creates an entity of {@code workflow_type} in its initial state with the page
 * {@code properties} as payload; a page already linked returns its entity. {@code page.updated} moves the
 * linked entity to the page's {@code status} when that differs from the current state.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotionWebhookHandler implements WebhookEventHandler {

    public static final String SOURCE = "notion";
    static final String PAGE_CREATED = "page.created";
    static final String PAGE_UPDATED = "page.updated";

    private final EntityStateService entityStateService;

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(PAGE_CREATED, PAGE_UPDATED);
    }

    @Override
    public Map<String, Object> handle(WebhookEvent event) {
        String pageId = WebhookPayloads.requireText(event.payload(), "page_id");
        if (PAGE_CREATED.equals(event.eventType())) {
            String workflowType = WebhookPayloads.requireText(event.payload(), "workflow_type");
            Map<String, Object> properties = WebhookPayloads.optionalObject(event.payload(), "properties");
            TransitionResult result = entityStateService.create(workflowType, null, properties, event.actor(), SOURCE, pageId);
            return WebhookPayloads.toResult(result);
        }

        Optional<EntitySnapshot> linked = entityStateService.findBySource(SOURCE, pageId);
        if (linked.isEmpty()) {
            log.info("Notion page not linked to an entity pageId={}", pageId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("applied", false);
            body.put("linked", false);
            return body;
        }
        String status = WebhookPayloads.optionalText(event.payload(), "status");
        if (status == null || status.equals(linked.get().state())) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("applied", false);
            body.put("entityId", linked.get().id().toString());
            body.put("state", linked.get().state());
            return body;
        }
        TransitionResult result = entityStateService.transition(linked.get().id(), status, event.actor(), "notion." + PAGE_UPDATED);
        return WebhookPayloads.toResult(result);
    }
}
