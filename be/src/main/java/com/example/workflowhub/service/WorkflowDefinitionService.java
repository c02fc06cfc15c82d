package com.example.workflowhub.service;

import com.example.workflowhub.api.UnknownWorkflowException;
import com.example.workflowhub.api.v1.dto.WorkflowDefinitionDto;
import com.example.workflowhub.api.v1.dto.WorkflowDefinitionResponse;
import com.example.workflowhub.api.v1.dto.WorkflowListItem;
import com.example.workflowhub.domain.WorkflowDefinition;
import com.example.workflowhub.notification.CollaboratorRegistry;
import com.example.workflowhub.repository.WorkflowDefinitionRepository;
import com.example.workflowhub.repository.WorkflowEntityRepository;
import com.example.workflowhub.validation.ValidationError;
import com.example.workflowhub.validation.WorkflowDefinitionValidationException;
import com.example.workflowhub.validation.WorkflowDefinitionValidator;
import com.example.workflowhub.workflow.WorkflowModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Administrative service for workflow definitions.
 * <p>
 * Validates a definition via {@link WorkflowDefinitionValidator} before it is stored, persists it as JSON in
 * {@link WorkflowDefinition#getDefinitionJson()} with an incremented definition version, and publishes the
 * compiled model to the {@link WorkflowDefinitionStore} once the change has committed.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowDefinitionService {

    private final WorkflowDefinitionRepository repository;
    private final WorkflowEntityRepository entityRepository;
    private final WorkflowDefinitionStore store;
    private final CollaboratorRegistry collaboratorRegistry;
    private final JsonMapper jsonMapper;

    /**
     * Creates or replaces the definition of {@code workflowType}. The type in the body, when given, must match.
     */
    @Transactional
    public WorkflowDefinitionResponse save(String workflowType, WorkflowDefinitionDto definition) {
        if (definition != null && definition.workflowType() != null && !definition.workflowType().equals(workflowType)) {
            throw new WorkflowDefinitionValidationException(List.of(new ValidationError(
                    "workflowType", "workflowType in body must match path: " + definition.workflowType())));
        }
        WorkflowDefinitionValidator.validate(definition, collaboratorRegistry.names());
        rejectRemovedStatesInUse(workflowType, definition);

        String definitionJson = writeDefinitionAsJson(definition);
        Instant now = Instant.now();
        Optional<WorkflowDefinition> existing = repository.findByWorkflowType(workflowType);
        WorkflowDefinition saved = existing
                .map(current -> new WorkflowDefinition(
                        current.getId(),
                        workflowType,
                        definition.description(),
                        definitionJson,
                        current.getDefinitionVersion() + 1,
                        current.getCreatedAt(),
                        now))
                .orElseGet(() -> new WorkflowDefinition(
                        UUID.randomUUID(),
                        workflowType,
                        definition.description(),
                        definitionJson,
                        1,
                        now,
                        now));
        repository.save(saved);

        WorkflowModel model = WorkflowModel.compile(definition, saved.getDefinitionVersion());
        publishAfterCommit(model);
        log.info("Saved workflow definition workflowType={} definitionVersion={} states={}",
                workflowType, saved.getDefinitionVersion(), definition.states().size());
        return toResponse(saved, definition);
    }

    @Transactional(readOnly = true)
    public List<WorkflowListItem> findAll() {
        List<WorkflowListItem> list = repository.findAll().stream()
                .sorted(Comparator.comparing(WorkflowDefinition::getWorkflowType))
                .map(this::toListItem)
                .toList();
        log.debug("findAll returned {} workflow definitions", list.size());
        return list;
    }

    @Transactional(readOnly = true)
    public WorkflowDefinitionResponse findByType(String workflowType) {
        WorkflowDefinition entity = repository.findByWorkflowType(workflowType)
                .orElseThrow(() -> new UnknownWorkflowException(workflowType));
        return toResponse(entity, readDefinitionFromJson(entity.getDefinitionJson()));
    }

    /**
     * Every entity must stay in a declared state, so a replacement may not drop a state that entities occupy.
     */
    private void rejectRemovedStatesInUse(String workflowType, WorkflowDefinitionDto definition) {
        List<ValidationError> errors = entityRepository.findStatesInUse(workflowType).stream()
                .filter(state -> !definition.states().contains(state))
                .sorted()
                .map(state -> new ValidationError("states", "state is occupied by existing entities: " + state))
                .toList();
        if (!errors.isEmpty()) {
            log.warn("Rejected definition for workflowType={}: removes occupied states {}", workflowType, errors);
            throw new WorkflowDefinitionValidationException(errors);
        }
    }

    private void publishAfterCommit(WorkflowModel model) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            store.register(model);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                store.register(model);
            }
        });
    }

    private WorkflowListItem toListItem(WorkflowDefinition entity) {
        return new WorkflowListItem(entity.getId(), entity.getWorkflowType(), entity.getDescription(),
                entity.getDefinitionVersion(), entity.getUpdatedAt());
    }

    private WorkflowDefinitionResponse toResponse(WorkflowDefinition entity, WorkflowDefinitionDto definition) {
        return new WorkflowDefinitionResponse(
                entity.getId(),
                entity.getWorkflowType(),
                entity.getDefinitionVersion(),
                definition,
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    private String writeDefinitionAsJson(WorkflowDefinitionDto definition) {
        try {
            return jsonMapper.writeValueAsString(definition);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow definition", e);
        }
    }

    private WorkflowDefinitionDto readDefinitionFromJson(String definitionJson) {
        try {
            return jsonMapper.readValue(definitionJson, WorkflowDefinitionDto.class);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize workflow definition", e);
        }
    }
}
