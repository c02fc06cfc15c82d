package com.example.workflowhub.notification;

import com.example.workflowhub.service.EntitySnapshot;
import com.example.workflowhub.service.WorkflowDefinitionStore;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers state-change notifications to collaborators asynchronously, at least once, with bounded retry.
 * <p>
 * Targets are the union of the workflow's notification targets for the new state and the transition's
 * {@code notify:} actions. Deliveries to the same {@code (entity, collaborator)} pair form one sequence: a
 * message starts only after the previous one was delivered or permanently failed. Concurrent commits may call
 * {@link #dispatch} out of version order, so a message older than the newest version already taken for its
 * pair is skipped; a collaborator never sees an older state after a newer one. Distinct pairs proceed in
 * parallel.
 * </p>
 */
@Component
@Slf4j
public class NotificationDispatcher {

    private final WorkflowDefinitionStore definitionStore;
    private final CollaboratorRegistry registry;
    private final NotificationRetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;

    private final ConcurrentMap<DeliveryKey, CompletableFuture<Void>> sequences = new ConcurrentHashMap<>();
    private final ConcurrentMap<DeliveryKey, Long> newestVersions = new ConcurrentHashMap<>();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong permanentlyFailed = new AtomicLong();
    private final AtomicLong skippedStale = new AtomicLong();

    public NotificationDispatcher(WorkflowDefinitionStore definitionStore,
                                  CollaboratorRegistry registry,
                                  NotificationRetryPolicy retryPolicy,
                                  @Qualifier("notificationScheduler") ScheduledExecutorService scheduler) {
        this.definitionStore = definitionStore;
        this.registry = registry;
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
    }

    /**
     * Enqueues deliveries for the entity's new state. Returns a future completing when every enqueued delivery
     * has finished (delivered or permanently failed); it never completes exceptionally.
     */
    public CompletableFuture<Void> dispatch(EntitySnapshot entity, Set<String> extraCollaborators) {
        Set<String> targets = new LinkedHashSet<>(definitionStore.getNotificationTargets(entity.workflowType(), entity.state()));
        if (extraCollaborators != null) {
            targets.addAll(extraCollaborators);
        }
        if (targets.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        NotificationMessage message = NotificationMessage.of(entity);
        List<CompletableFuture<Void>> deliveries = new ArrayList<>();
        for (String name : targets) {
            Collaborator collaborator = registry.find(name).orElse(null);
            if (collaborator == null) {
                log.error("Dropping notification for unregistered collaborator={} entityId={} state={}", name, entity.id(), entity.state());
                continue;
            }
            deliveries.add(enqueue(new DeliveryKey(entity.id(), name), collaborator, message));
        }
        log.debug("Dispatched entityId={} state={} version={} to {} collaborator(s)", entity.id(), entity.state(), entity.version(), deliveries.size());
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]));
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long permanentlyFailedCount() {
        return permanentlyFailed.get();
    }

    public long skippedStaleCount() {
        return skippedStale.get();
    }

    private CompletableFuture<Void> enqueue(DeliveryKey key, Collaborator collaborator, NotificationMessage message) {
        CompletableFuture<Void> next = sequences.compute(key, (k, tail) -> {
            CompletableFuture<Void> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            return previous
                    .handle((ignored, error) -> null)
                    .thenComposeAsync(ignored -> isStale(key, message)
                            ? CompletableFuture.<Void>completedFuture(null)
                            : deliver(collaborator, message), scheduler);
        });
        next.whenComplete((ignored, error) -> sequences.remove(key, next));
        return next.exceptionally(error -> {
            permanentlyFailed.incrementAndGet();
            log.error("Notification not delivered collaborator={} entityId={} state={}: {}",
                    collaborator.name(), message.entityId(), message.newState(), error.getMessage());
            return null;
        });
    }

    private boolean isStale(DeliveryKey key, NotificationMessage message) {
        long newest = newestVersions.merge(key, message.version(), Math::max);
        if (message.version() >= newest) {
            return false;
        }
        skippedStale.incrementAndGet();
        log.info("Skipping stale notification collaborator={} entityId={} state={} version={} newestVersion={}",
                key.collaborator(), message.entityId(), message.newState(), message.version(), newest);
        return true;
    }

    private CompletableFuture<Void> deliver(Collaborator collaborator, NotificationMessage message) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        attempt(collaborator, message, 1, done);
        return done;
    }

    private void attempt(Collaborator collaborator, NotificationMessage message, int attempt, CompletableFuture<Void> done) {
        try {
            collaborator.notify(message);
            delivered.incrementAndGet();
            log.debug("Delivered collaborator={} entityId={} state={} attempt={}", collaborator.name(), message.entityId(), message.newState(), attempt);
            done.complete(null);
        } catch (RuntimeException e) {
            if (attempt >= retryPolicy.maxAttempts()) {
                permanentlyFailed.incrementAndGet();
                log.error("Notification permanently failed collaborator={} entityId={} state={} version={} attempts={}: {}",
                        collaborator.name(), message.entityId(), message.newState(), message.version(), attempt, e.getMessage());
                done.complete(null);
                return;
            }
            long delayMillis = retryPolicy.delayBeforeRetry(attempt).toMillis();
            log.warn("Notification failed collaborator={} entityId={} state={} attempt={}; retrying in {}ms: {}",
                    collaborator.name(), message.entityId(), message.newState(), attempt, delayMillis, e.getMessage());
            try {
                scheduler.schedule(() -> attempt(collaborator, message, attempt + 1, done), delayMillis, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException rejected) {
                permanentlyFailed.incrementAndGet();
                log.error("Notification retry not scheduled (dispatcher shutting down) collaborator={} entityId={} state={}",
                        collaborator.name(), message.entityId(), message.newState());
                done.complete(null);
            }
        }
    }

    private record DeliveryKey(UUID entityId, String collaborator) {
    }
}
