package com.example.workflowhub.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Collaborator without an endpoint (in-process agents, log-only sinks).
 */
@Slf4j
public class LoggingCollaborator implements Collaborator {

    private final String name;

    public LoggingCollaborator(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void notify(NotificationMessage message) {
        log.info("Notify collaborator={} entityId={} workflowType={} state={} version={}",
                name, message.entityId(), message.workflowType(), message.newState(), message.version());
    }
}
