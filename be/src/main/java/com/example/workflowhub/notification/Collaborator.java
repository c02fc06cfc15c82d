package com.example.workflowhub.notification;

/**
 * A named party informed of entity state changes. Implementations throw on delivery failure;
 * retries are the {@link NotificationDispatcher}'s job.
 */
public interface Collaborator {

    String name();

    void notify(NotificationMessage message);
}
