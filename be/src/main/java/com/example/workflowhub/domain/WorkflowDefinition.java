package com.example.workflowhub.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for an administratively managed workflow definition.
 * <p>
 * Stores the workflow type, its full definition (states, transitions, notification targets) as JSON in
 * {@code definition_json}, and a definition version incremented on every edit.
 * </p>
 */
@Entity
@Table(name = "workflow_definition")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowDefinition {

    @Id
    private UUID id;

    @Column(name = "workflow_type", nullable = false, unique = true, length = 255)
    private String workflowType;

    @Column(length = 1000)
    private String description;

    @Column(name = "definition_json", nullable = false, columnDefinition = "CLOB")
    private String definitionJson;

    @Column(name = "definition_version", nullable = false)
    private int definitionVersion;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public WorkflowDefinition(UUID id, String workflowType, String description, String definitionJson,
                              int definitionVersion, Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.workflowType = Objects.requireNonNull(workflowType, "workflowType");
        this.description = description;
        this.definitionJson = Objects.requireNonNull(definitionJson, "definitionJson");
        this.definitionVersion = definitionVersion;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
