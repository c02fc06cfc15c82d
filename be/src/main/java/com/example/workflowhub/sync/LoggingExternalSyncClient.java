package com.example.workflowhub.sync;

import com.example.workflowhub.service.EntitySnapshot;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no system-of-record url is configured: records the push in the log only.
 */
@Slf4j
public class LoggingExternalSyncClient implements ExternalSyncClient {

    @Override
    public void push(EntitySnapshot entity) {
        log.info("System of record sync (log only) entityId={} workflowType={} state={} version={}",
                entity.id(), entity.workflowType(), entity.state(), entity.version());
    }
}
