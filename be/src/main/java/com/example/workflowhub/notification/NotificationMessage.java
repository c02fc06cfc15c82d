package com.example.workflowhub.notification;

import com.example.workflowhub.service.EntitySnapshot;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Body delivered to collaborators when an entity enters a state.
 */
public record NotificationMessage(
        UUID entityId,
        String workflowType,
        String newState,
        long version,
        Map<String, Object> payload,
        String sourceSystem,
        String sourceRecordId,
        Instant occurredAt
) {

    public static NotificationMessage of(EntitySnapshot entity) {
        return new NotificationMessage(entity.id(), entity.workflowType(), entity.state(), entity.version(),
                entity.payload(), entity.sourceSystem(), entity.sourceRecordId(), entity.updatedAt());
    }
}
