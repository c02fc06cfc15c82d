package com.example.workflowhub.webhook.handler;

import com.example.workflowhub.service.EntitySnapshot;
import com.example.workflowhub.service.EntityStateService;
import com.example.workflowhub.service.TransitionResult;
import com.example.workflowhub.webhook.MalformedWebhookPayloadException;
import com.example.workflowhub.webhook.WebhookEvent;
import com.example.workflowhub.webhook.WebhookEventHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Amelia wellness bookings, tracked as {@value #WORKFLOW_TYPE} entities keyed by {@code booking_id}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AmeliaWebhookHandler implements WebhookEventHandler {

    public static final String SOURCE = "amelia";
    public static final String WORKFLOW_TYPE = "WellnessBooking";
    static final String BOOKING_CREATED = "booking.created";
    static final String BOOKING_STATUS_CHANGED = "booking.status_changed";

    /** Amelia booking status to workflow state. */
    private static final Map<String, String> STATUS_TO_STATE = Map.of(
            "pending", "requested",
            "approved", "confirmed",
            "canceled", "canceled",
            "rejected", "canceled",
            "completed", "completed",
            "no-show", "no_show"
    );

    private final EntityStateService entityStateService;

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(BOOKING_CREATED, BOOKING_STATUS_CHANGED);
    }

    @Override
    public Map<String, Object> handle(WebhookEvent event) {
        String bookingId = WebhookPayloads.requireText(event.payload(), "booking_id");
        if (BOOKING_CREATED.equals(event.eventType())) {
            Map<String, Object> payload = new LinkedHashMap<>(event.payload());
            payload.remove("booking_id");
            TransitionResult result = entityStateService.create(WORKFLOW_TYPE, null, payload, event.actor(), SOURCE, bookingId);
            return WebhookPayloads.toResult(result);
        }

        String status = WebhookPayloads.requireText(event.payload(), "status").toLowerCase(Locale.ROOT);
        String toState = STATUS_TO_STATE.get(status);
        if (toState == null) {
            throw new MalformedWebhookPayloadException("Unknown booking status: " + status);
        }
        Optional<EntitySnapshot> booking = entityStateService.findBySource(SOURCE, bookingId);
        if (booking.isEmpty()) {
            log.info("Amelia booking not tracked bookingId={}", bookingId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("applied", false);
            body.put("linked", false);
            return body;
        }
        TransitionResult result = entityStateService.transition(booking.get().id(), toState, event.actor(),
                SOURCE + "." + BOOKING_STATUS_CHANGED);
        return WebhookPayloads.toResult(result);
    }
}
