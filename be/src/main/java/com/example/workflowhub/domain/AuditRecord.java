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
import java.util.UUID;

/**
 * Immutable audit trail entry for one transition attempt, applied or rejected.
 * <p>
 * {@code fromState} is null for the creation of an entity. {@code reason} holds the error code of a
 * rejected attempt and {@code detail} its machine-readable detail.
 * </p>
 */
@Entity
@Table(name = "audit_record", indexes = @Index(name = "ix_audit_record_entity", columnList = "entity_id, recorded_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private UUID entityId;

    @Column(name = "workflow_type", nullable = false, updatable = false, length = 255)
    private String workflowType;

    @Column(name = "from_state", updatable = false, length = 255)
    private String fromState;

    @Column(name = "to_state", nullable = false, updatable = false, length = 255)
    private String toState;

    @Column(nullable = false, updatable = false, length = 255)
    private String actor;

    @Column(name = "trigger_event", updatable = false, length = 255)
    private String triggerEvent;

    @Column(name = "correlation_id", nullable = false, updatable = false)
    private UUID correlationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private AuditOutcome outcome;

    @Column(updatable = false, length = 50)
    private String reason;

    @Column(updatable = false, length = 500)
    private String detail;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    public AuditRecord(UUID entityId, String workflowType, String fromState, String toState, String actor,
                       String triggerEvent, UUID correlationId, AuditOutcome outcome, String reason, String detail,
                       Instant recordedAt) {
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.workflowType = Objects.requireNonNull(workflowType, "workflowType");
        this.fromState = fromState;
        this.toState = Objects.requireNonNull(toState, "toState");
        this.actor = Objects.requireNonNull(actor, "actor");
        this.triggerEvent = triggerEvent;
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.reason = reason;
        this.detail = detail;
        this.recordedAt = Objects.requireNonNull(recordedAt, "recordedAt");
    }
}
