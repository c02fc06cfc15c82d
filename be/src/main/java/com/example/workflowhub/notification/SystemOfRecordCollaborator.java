package com.example.workflowhub.notification;

import com.example.workflowhub.service.EntitySnapshot;
import com.example.workflowhub.sync.ExternalSyncClient;

/**
 * Routes {@code sync:external} post actions through the dispatcher so best-effort sync gets the same
 * retry and per-entity ordering as notifications.
 */
public class SystemOfRecordCollaborator implements Collaborator {

    public static final String NAME = "system-of-record";

    private final ExternalSyncClient syncClient;

    public SystemOfRecordCollaborator(ExternalSyncClient syncClient) {
        this.syncClient = syncClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void notify(NotificationMessage message) {
        syncClient.push(new EntitySnapshot(
                message.entityId(),
                message.workflowType(),
                message.newState(),
                message.version(),
                message.payload(),
                message.sourceSystem(),
                message.sourceRecordId(),
                message.occurredAt()));
    }
}
