package com.example.workflowhub.service;

import com.example.workflowhub.api.EntityNotFoundException;
import com.example.workflowhub.api.TransitionCancelledException;
import com.example.workflowhub.api.UnknownWorkflowException;
import com.example.workflowhub.config.HubProperties;
import com.example.workflowhub.domain.AuditOutcome;
import com.example.workflowhub.domain.WorkflowEntity;
import com.example.workflowhub.notification.NotificationDispatcher;
import com.example.workflowhub.notification.SystemOfRecordCollaborator;
import com.example.workflowhub.repository.WorkflowEntityRepository;
import com.example.workflowhub.security.Actor;
import com.example.workflowhub.sync.ExternalSyncClient;
import com.example.workflowhub.sync.ExternalSyncException;
import com.example.workflowhub.sync.SyncPolicy;
import com.example.workflowhub.workflow.TransitionRule;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Applies state changes to workflow entities.
 * <p>
 * A transition is validated against the workflow definition, then written with a single version-checked
 * update: of several concurrent requests against the same version at most one wins, the others are rejected
 * with {@code Conflict} and never retried here. The {@code APPLIED} audit record (and, under
 * {@link SyncPolicy#REQUIRED}, the system-of-record push) share the update's transaction. Notifications run
 * after commit and cannot undo a committed transition.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityStateService {

    private final WorkflowEntityRepository entityRepository;
    private final WorkflowDefinitionStore definitionStore;
    private final TransitionValidator validator;
    private final AuditLogService auditLog;
    private final NotificationDispatcher dispatcher;
    private final ExternalSyncClient syncClient;
    private final HubProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final JsonMapper jsonMapper;

    /**
     * Moves an entity to {@code toState} on behalf of {@code actor}.
     *
     * @throws EntityNotFoundException      when no entity has this id
     * @throws TransitionCancelledException when the calling thread is interrupted before the write
     */
    public TransitionResult transition(UUID entityId, String toState, Actor actor, String triggerEvent) {
        Objects.requireNonNull(actor, "actor");
        UUID correlationId = UUID.randomUUID();
        EntitySnapshot current = find(entityId);

        TransitionDecision decision = validator.validate(current.workflowType(), current.state(), toState, actor, current.payload());
        if (!decision.allowed()) {
            return reject(current, toState, actor, triggerEvent, correlationId, decision.code(), decision.detail());
        }
        TransitionRule rule = decision.rule();
        String trigger = triggerEvent != null ? triggerEvent : rule.trigger();

        if (Thread.currentThread().isInterrupted()) {
            log.info("Transition cancelled entityId={} {}->{} correlationId={}", entityId, current.state(), toState, correlationId);
            throw new TransitionCancelledException(entityId);
        }

        boolean syncInTransaction = rule.syncsExternally() && syncPolicy() == SyncPolicy.REQUIRED;
        Instant now = Instant.now();
        EntitySnapshot applied;
        try {
            applied = transactionTemplate.execute(status -> {
                int updated = entityRepository.compareAndSetState(entityId, current.version(), toState, now);
                if (updated == 0) {
                    return null;
                }
                EntitySnapshot next = current.withState(toState, current.version() + 1, now);
                if (rule.auditRequired()) {
                    auditLog.record(entityId, current.workflowType(), current.state(), toState, actor.id(), trigger,
                            correlationId, AuditOutcome.APPLIED, null, null);
                }
                if (syncInTransaction) {
                    syncClient.push(next);
                }
                return next;
            });
        } catch (ExternalSyncException e) {
            return reject(current, toState, actor, trigger, correlationId, TransitionErrorCode.SYNC_FAILED,
                    "sync_failed:" + e.getMessage());
        } catch (ConcurrencyFailureException e) {
            log.debug("Concurrent write detected by the database entityId={}: {}", entityId, e.getMessage());
            applied = null;
        }
        if (applied == null) {
            return reject(current, toState, actor, trigger, correlationId, TransitionErrorCode.CONFLICT,
                    "version_conflict:expected:" + current.version());
        }

        log.info("Transition applied entityId={} workflowType={} {}->{} version={} actor={} correlationId={}",
                entityId, current.workflowType(), current.state(), toState, applied.version(), actor.id(), correlationId);
        if (!rule.auditRequired()) {
            auditAfterCommit(applied, current.state(), actor, trigger, correlationId);
        }
        runPostActions(applied, rule);
        return TransitionResult.applied(applied, correlationId);
    }

    /**
     * Creates an entity in its workflow's initial state. When {@code sourceSystem} and {@code sourceRecordId}
     * are both given and an entity with that linkage exists, it is returned unchanged.
     *
     * @param requestedState state to create in; {@code null} means the initial state
     */
    public TransitionResult create(String workflowType, String requestedState, Map<String, Object> payload, Actor actor,
                                   String sourceSystem, String sourceRecordId) {
        Objects.requireNonNull(actor, "actor");
        UUID correlationId = UUID.randomUUID();
        boolean linked = sourceSystem != null && sourceRecordId != null;
        if (linked) {
            Optional<EntitySnapshot> existing = findBySource(sourceSystem, sourceRecordId);
            if (existing.isPresent()) {
                log.info("Entity already linked sourceSystem={} sourceRecordId={} entityId={}",
                        sourceSystem, sourceRecordId, existing.get().id());
                return TransitionResult.applied(existing.get(), correlationId);
            }
        }

        String target = requestedState;
        if (target == null) {
            try {
                target = definitionStore.getInitialState(workflowType);
            } catch (UnknownWorkflowException e) {
                log.warn("Creation rejected workflowType={} code=UnknownWorkflow correlationId={}", workflowType, correlationId);
                return TransitionResult.rejected(TransitionErrorCode.UNKNOWN_WORKFLOW, "unknown_workflow:" + workflowType, correlationId);
            }
        }
        TransitionDecision decision = validator.validate(workflowType, null, target, actor, payload);
        if (!decision.allowed()) {
            log.warn("Creation rejected workflowType={} state={} code={} detail={} correlationId={}",
                    workflowType, target, decision.code().code(), decision.detail(), correlationId);
            return TransitionResult.rejected(decision.code(), decision.detail(), correlationId);
        }

        String initialState = target;
        Map<String, Object> safePayload = payload != null ? payload : Map.of();
        String payloadJson = writePayload(safePayload);
        Instant now = Instant.now();
        UUID entityId = UUID.randomUUID();
        EntitySnapshot created;
        try {
            created = transactionTemplate.execute(status -> {
                WorkflowEntity entity = new WorkflowEntity(entityId, workflowType, initialState, payloadJson,
                        sourceSystem, sourceRecordId, now);
                entityRepository.saveAndFlush(entity);
                auditLog.record(entityId, workflowType, null, initialState, actor.id(), "create", correlationId,
                        AuditOutcome.APPLIED, null, null);
                return toSnapshot(entity, safePayload);
            });
        } catch (DataIntegrityViolationException e) {
            if (linked) {
                Optional<EntitySnapshot> winner = findBySource(sourceSystem, sourceRecordId);
                if (winner.isPresent()) {
                    log.info("Concurrent creation for sourceSystem={} sourceRecordId={}; returning entityId={}",
                            sourceSystem, sourceRecordId, winner.get().id());
                    return TransitionResult.applied(winner.get(), correlationId);
                }
            }
            throw e;
        }

        log.info("Entity created entityId={} workflowType={} state={} actor={} correlationId={}",
                entityId, workflowType, initialState, actor.id(), correlationId);
        runPostActions(created, null);
        return TransitionResult.applied(created, correlationId);
    }

    public EntitySnapshot find(UUID entityId) {
        WorkflowEntity entity = entityRepository.findById(entityId)
                .orElseThrow(() -> new EntityNotFoundException(entityId));
        return toSnapshot(entity, readPayload(entity.getPayloadJson()));
    }

    public Optional<EntitySnapshot> findBySource(String sourceSystem, String sourceRecordId) {
        return entityRepository.findBySourceSystemAndSourceRecordId(sourceSystem, sourceRecordId)
                .map(entity -> toSnapshot(entity, readPayload(entity.getPayloadJson())));
    }

    private TransitionResult reject(EntitySnapshot current, String toState, Actor actor, String triggerEvent,
                                    UUID correlationId, TransitionErrorCode code, String detail) {
        auditLog.record(current.id(), current.workflowType(), current.state(), toState != null ? toState : "",
                actor.id(), triggerEvent, correlationId, AuditOutcome.REJECTED,
                code.code(), detail);
        log.warn("Transition rejected entityId={} {}->{} code={} detail={} correlationId={}",
                current.id(), current.state(), toState, code.code(), detail, correlationId);
        return TransitionResult.rejected(code, detail, correlationId);
    }

    private void auditAfterCommit(EntitySnapshot applied, String fromState, Actor actor, String trigger, UUID correlationId) {
        try {
            auditLog.record(applied.id(), applied.workflowType(), fromState, applied.state(), actor.id(), trigger,
                    correlationId, AuditOutcome.APPLIED, null, null);
        } catch (RuntimeException e) {
            log.error("Audit write failed after commit entityId={} {}->{} correlationId={}",
                    applied.id(), fromState, applied.state(), correlationId, e);
        }
    }

    private void runPostActions(EntitySnapshot entity, TransitionRule rule) {
        Set<String> extras = new HashSet<>();
        if (rule != null) {
            extras.addAll(rule.notifiedCollaborators());
            if (rule.syncsExternally() && syncPolicy() == SyncPolicy.BEST_EFFORT) {
                extras.add(SystemOfRecordCollaborator.NAME);
            }
        }
        try {
            dispatcher.dispatch(entity, extras);
        } catch (RuntimeException e) {
            log.error("Post actions not dispatched entityId={} state={}", entity.id(), entity.state(), e);
        }
    }

    private SyncPolicy syncPolicy() {
        return properties.getSync().getPolicy();
    }

    private EntitySnapshot toSnapshot(WorkflowEntity entity, Map<String, Object> payload) {
        return new EntitySnapshot(
                entity.getId(),
                entity.getWorkflowType(),
                entity.getState(),
                entity.getVersion(),
                payload,
                entity.getSourceSystem(),
                entity.getSourceRecordId(),
                entity.getUpdatedAt()
        );
    }

    private String writePayload(Map<String, Object> payload) {
        try {
            return jsonMapper.writeValueAsString(payload);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize entity payload", e);
        }
    }

    private Map<String, Object> readPayload(String payloadJson) {
        try {
            return jsonMapper.readValue(payloadJson, new TypeReference<LinkedHashMap<String, Object>>() { });
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize entity payload", e);
        }
    }
}
