package com.example.workflowhub.api.v1;

import com.example.workflowhub.api.ErrorResponse;
import com.example.workflowhub.api.v1.dto.AuditRecordResponse;
import com.example.workflowhub.api.v1.dto.AuditTrailResponse;
import com.example.workflowhub.api.v1.dto.CreateEntityRequest;
import com.example.workflowhub.api.v1.dto.EntityResponse;
import com.example.workflowhub.api.v1.dto.TransitionRequest;
import com.example.workflowhub.domain.AuditRecord;
import com.example.workflowhub.security.Actor;
import com.example.workflowhub.security.ActorAuthenticationFilter;
import com.example.workflowhub.service.AuditLogService;
import com.example.workflowhub.service.EntitySnapshot;
import com.example.workflowhub.service.EntityStateService;
import com.example.workflowhub.service.TransitionErrorCode;
import com.example.workflowhub.service.TransitionResult;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for workflow entities.
 * <p>
 * Exposes {@code /api/v1/entities} for create (POST), get by id (GET /{id}), audit trail (GET /{id}/audit)
 * and state transitions (POST /{id}/transitions). The acting identity is the authenticated actor.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/entities")
@RequiredArgsConstructor
@Slf4j
public class EntityController {

    private final EntityStateService entityStateService;
    private final AuditLogService auditLogService;

    @PostMapping
    public ResponseEntity<?> create(@RequestAttribute(ActorAuthenticationFilter.ACTOR_ATTRIBUTE) Actor actor,
                                    @Valid @RequestBody CreateEntityRequest request) {
        log.info("Creating entity workflowType={} state={} actor={}", request.workflowType(), request.state(), actor.id());
        TransitionResult result = entityStateService.create(request.workflowType(), request.state(), request.payload(),
                actor, request.sourceSystem(), request.sourceRecordId());
        if (!result.isApplied()) {
            return errorResponse(result);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(result.entity(), result.correlationId()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EntityResponse> getById(@PathVariable UUID id) {
        log.debug("Getting entity id={}", id);
        return ResponseEntity.ok(toResponse(entityStateService.find(id), null));
    }

    @GetMapping("/{id}/audit")
    public ResponseEntity<AuditTrailResponse> audit(@PathVariable UUID id) {
        entityStateService.find(id);
        List<AuditRecordResponse> records = auditLogService.findByEntity(id).stream()
                .map(EntityController::toResponse)
                .toList();
        log.debug("Audit trail id={} records={}", id, records.size());
        return ResponseEntity.ok(new AuditTrailResponse(id, records));
    }

    @PostMapping("/{id}/transitions")
    public ResponseEntity<?> transition(@RequestAttribute(ActorAuthenticationFilter.ACTOR_ATTRIBUTE) Actor actor,
                                        @PathVariable UUID id,
                                        @Valid @RequestBody TransitionRequest request) {
        log.info("Transition requested id={} toState={} actor={}", id, request.toState(), actor.id());
        TransitionResult result = entityStateService.transition(id, request.toState(), actor, request.triggerEvent());
        if (!result.isApplied()) {
            return errorResponse(result);
        }
        return ResponseEntity.ok(toResponse(result.entity(), result.correlationId()));
    }

    static HttpStatus statusFor(TransitionErrorCode code) {
        return switch (code) {
            case NO_SUCH_TRANSITION, PRECONDITION_FAILED, INVALID_CREATION_STATE, WORKFLOW_TERMINATED -> HttpStatus.UNPROCESSABLE_CONTENT;
            case ACTOR_NOT_PERMITTED -> HttpStatus.FORBIDDEN;
            case CONFLICT -> HttpStatus.CONFLICT;
            case UNKNOWN_WORKFLOW -> HttpStatus.NOT_FOUND;
            case UNKNOWN_STATE -> HttpStatus.BAD_REQUEST;
            case SYNC_FAILED -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static ResponseEntity<ErrorResponse> errorResponse(TransitionResult result) {
        TransitionErrorCode code = result.error().code();
        return ResponseEntity.status(statusFor(code)).body(new ErrorResponse(code.code(), result.error().message()));
    }

    private static EntityResponse toResponse(EntitySnapshot entity, UUID correlationId) {
        return new EntityResponse(
                entity.id(),
                entity.workflowType(),
                entity.state(),
                entity.version(),
                entity.payload(),
                entity.sourceSystem(),
                entity.sourceRecordId(),
                entity.updatedAt(),
                correlationId
        );
    }

    private static AuditRecordResponse toResponse(AuditRecord record) {
        return new AuditRecordResponse(
                record.getId(),
                record.getEntityId(),
                record.getWorkflowType(),
                record.getFromState(),
                record.getToState(),
                record.getActor(),
                record.getTriggerEvent(),
                record.getCorrelationId(),
                record.getOutcome().name(),
                record.getReason(),
                record.getDetail(),
                record.getRecordedAt()
        );
    }
}
