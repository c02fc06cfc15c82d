package com.example.workflowhub.sync;

import com.example.workflowhub.service.EntitySnapshot;

/**
 * Outbound push of an entity's current state to the external system of record.
 */
public interface ExternalSyncClient {

    /**
     * @throws ExternalSyncException if the system of record did not accept the update
     */
    void push(EntitySnapshot entity);
}
