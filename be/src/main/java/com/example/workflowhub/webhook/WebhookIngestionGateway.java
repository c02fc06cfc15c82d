package com.example.workflowhub.webhook;

import com.example.workflowhub.config.HubProperties;
import com.example.workflowhub.domain.WebhookOutcome;
import com.example.workflowhub.security.Actor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for inbound webhooks.
 * <p>
 * An attempt passes, in order: source lookup, signature check over the raw bytes, per-caller rate limit,
 * envelope parsing and handler routing. Each attempt, whatever its outcome, writes exactly one
 * {@link com.example.workflowhub.domain.WebhookLogRecord}. Nothing in the body is trusted before the
 * signature has been verified.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestionGateway {

    static final String HANDLER_FAILURE_MESSAGE = "Webhook processing failed";

    private final SecretResolver secretResolver;
    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookRateLimiter rateLimiter;
    private final WebhookHandlerRegistry handlerRegistry;
    private final WebhookLogService logService;
    private final HubProperties properties;
    private final JsonMapper jsonMapper;

    public IngestResult ingest(String source, HttpHeaders headers, byte[] rawBody, String caller) {
        byte[] body = rawBody != null ? rawBody : new byte[0];

        Optional<String> secret = secretResolver.resolve(source);
        if (secret.isEmpty()) {
            return reject(source, null, caller, WebhookOutcome.UNKNOWN_SOURCE, body, "Unknown webhook source");
        }
        String signature = headers != null ? headers.getFirst(WebhookSignatureVerifier.SIGNATURE_HEADER) : null;
        if (!signatureVerifier.verify(secret.get(), body, signature)) {
            String reason = signature == null ? "Missing webhook signature" : "Invalid webhook signature";
            return reject(source, null, caller, WebhookOutcome.AUTHENTICATION_FAILURE, body, reason);
        }
        if (!rateLimiter.tryAcquire(source, caller)) {
            return reject(source, null, caller, WebhookOutcome.RATE_LIMITED, body, "Rate limit exceeded");
        }

        WebhookEnvelope envelope;
        try {
            envelope = jsonMapper.readValue(body, WebhookEnvelope.class);
        } catch (JacksonException e) {
            return reject(source, null, caller, WebhookOutcome.MALFORMED_PAYLOAD, body, "Malformed webhook body");
        }
        if (envelope == null || envelope.eventType() == null || envelope.eventType().isBlank()) {
            return reject(source, null, caller, WebhookOutcome.MALFORMED_PAYLOAD, body, "Missing event_type");
        }
        if (envelope.source() != null && !envelope.source().equals(source)) {
            return reject(source, envelope.eventType(), caller, WebhookOutcome.MALFORMED_PAYLOAD, body,
                    "Body source does not match endpoint source");
        }
        Optional<WebhookEventHandler> handler = handlerRegistry.find(source, envelope.eventType());
        if (handler.isEmpty()) {
            return reject(source, envelope.eventType(), caller, WebhookOutcome.UNSUPPORTED_EVENT, body,
                    "Unsupported event type: " + envelope.eventType());
        }

        WebhookEvent event = new WebhookEvent(source, envelope.eventType(), envelope.payload(), systemActor(source), caller);
        Map<String, Object> result;
        try {
            result = handler.get().handle(event);
        } catch (MalformedWebhookPayloadException e) {
            return reject(source, envelope.eventType(), caller, WebhookOutcome.MALFORMED_PAYLOAD, body, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Webhook handler failed source={} eventType={} caller={}", source, envelope.eventType(), caller, e);
            logService.record(source, envelope.eventType(), caller, WebhookOutcome.ERROR, body, describe(e));
            return IngestResult.rejected(WebhookOutcome.ERROR, HANDLER_FAILURE_MESSAGE);
        }
        logService.record(source, envelope.eventType(), caller, WebhookOutcome.SUCCESS, body, null);
        return IngestResult.accepted(result);
    }

    private IngestResult reject(String source, String eventType, String caller, WebhookOutcome outcome,
                                byte[] body, String message) {
        log.warn("Webhook rejected source={} eventType={} caller={} outcome={}: {}", source, eventType, caller, outcome, message);
        logService.record(source != null ? source : "unknown", eventType, caller, outcome, body, message);
        return IngestResult.rejected(outcome, message);
    }

    static String describe(Exception e) {
        String name = e.getClass().getSimpleName();
        return e.getMessage() != null ? name + ": " + e.getMessage() : name;
    }

    private Actor systemActor(String source) {
        HubProperties.Source configured = properties.getWebhooks().getSources().get(source);
        return Actor.webhookSource(source, configured != null ? new HashSet<>(configured.getActorRoles()) : Set.of());
    }
}
