package com.example.workflowhub.service;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only view of an entity at one version. Payload values may be null, as in the stored JSON.
 */
public record EntitySnapshot(
        UUID id,
        String workflowType,
        String state,
        long version,
        Map<String, Object> payload,
        String sourceSystem,
        String sourceRecordId,
        Instant updatedAt
) {

    public EntitySnapshot {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    public EntitySnapshot withState(String newState, long newVersion, Instant newUpdatedAt) {
        return new EntitySnapshot(id, workflowType, newState, newVersion, payload, sourceSystem, sourceRecordId, newUpdatedAt);
    }
}
