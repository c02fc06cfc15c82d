package com.example.workflowhub.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one inbound webhook attempt, authenticated or not. Ids follow arrival order.
 * <p>
 * The raw body is never stored: only its SHA-256 digest and size.
 * </p>
 */
@Entity
@Table(name = "webhook_log", indexes = @Index(name = "ix_webhook_log_source", columnList = "source, received_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WebhookLogRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 100)
    private String source;

    @Column(name = "event_type", updatable = false, length = 255)
    private String eventType;

    @Column(name = "caller", updatable = false, length = 255)
    private String caller;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private WebhookOutcome outcome;

    @Column(name = "payload_digest", nullable = false, updatable = false, length = 64)
    private String payloadDigest;

    @Column(name = "payload_size", nullable = false, updatable = false)
    private int payloadSize;

    @Column(name = "error_message", updatable = false, length = 500)
    private String errorMessage;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    public WebhookLogRecord(String source, String eventType, String caller, WebhookOutcome outcome,
                            String payloadDigest, int payloadSize, String errorMessage, Instant receivedAt) {
        this.source = Objects.requireNonNull(source, "source");
        this.eventType = eventType;
        this.caller = caller;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.payloadDigest = Objects.requireNonNull(payloadDigest, "payloadDigest");
        this.payloadSize = payloadSize;
        this.errorMessage = errorMessage;
        this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt");
    }
}
