package com.example.workflowhub.service;

import com.example.workflowhub.domain.AuditOutcome;
import com.example.workflowhub.domain.AuditRecord;
import com.example.workflowhub.repository.AuditRecordRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit trail of transition attempts.
 * <p>
 * {@link #record} joins the caller's transaction when there is one, so an applied transition and its
 * {@code APPLIED} record commit or roll back together. Write failures propagate to the caller.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    private final AuditRecordRepository repository;

    @Transactional(propagation = Propagation.REQUIRED)
    public AuditRecord record(UUID entityId, String workflowType, String fromState, String toState, String actor,
                              String triggerEvent, UUID correlationId, AuditOutcome outcome, String reason,
                              String detail) {
        AuditRecord saved = repository.save(new AuditRecord(
                entityId,
                workflowType,
                fromState,
                toState,
                actor,
                triggerEvent,
                correlationId,
                outcome,
                reason,
                detail,
                Instant.now()));
        log.debug("Audit entityId={} {}->{} actor={} outcome={} reason={} correlationId={}",
                entityId, fromState, toState, actor, outcome, reason, correlationId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<AuditRecord> findByEntity(UUID entityId) {
        return repository.findByEntityIdOrderByIdAsc(entityId);
    }
}
