package com.example.workflowhub.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for a business record moving through a workflow.
 * <p>
 * {@code state} and {@code version} have no setters: they change only through
 * {@link com.example.workflowhub.repository.WorkflowEntityRepository#compareAndSetState}, a single
 * version-checked update. Records are never deleted; terminal states close them.
 * </p>
 */
@Entity
@Table(
        name = "workflow_entity",
        uniqueConstraints = @UniqueConstraint(name = "uk_workflow_entity_source", columnNames = {"source_system", "source_record_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowEntity {

    @Id
    private UUID id;

    @Column(name = "workflow_type", nullable = false, length = 255)
    private String workflowType;

    @Column(nullable = false, length = 255)
    private String state;

    @Column(nullable = false)
    private long version;

    @Column(name = "payload_json", nullable = false, columnDefinition = "CLOB")
    private String payloadJson;

    @Column(name = "source_system", length = 100)
    private String sourceSystem;

    @Column(name = "source_record_id", length = 255)
    private String sourceRecordId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public WorkflowEntity(UUID id, String workflowType, String state, String payloadJson,
                          String sourceSystem, String sourceRecordId, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.workflowType = Objects.requireNonNull(workflowType, "workflowType");
        this.state = Objects.requireNonNull(state, "state");
        this.version = 0L;
        this.payloadJson = Objects.requireNonNull(payloadJson, "payloadJson");
        this.sourceSystem = sourceSystem;
        this.sourceRecordId = sourceRecordId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }
}
