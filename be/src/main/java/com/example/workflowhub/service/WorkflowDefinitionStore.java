package com.example.workflowhub.service;

import com.example.workflowhub.api.UnknownStateException;
import com.example.workflowhub.api.UnknownWorkflowException;
import com.example.workflowhub.api.v1.dto.WorkflowDefinitionDto;
import com.example.workflowhub.domain.WorkflowDefinition;
import com.example.workflowhub.repository.WorkflowDefinitionRepository;
import com.example.workflowhub.workflow.TransitionRule;
import com.example.workflowhub.workflow.WorkflowModel;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Read side of workflow definitions: compiled {@link WorkflowModel}s by workflow type.
 * <p>
 * Readers go through an immutable map published via a volatile field and never block; administrative
 * changes compile a new model and swap the map.
 * </p>
 */
@Component
@Slf4j
public class WorkflowDefinitionStore {

    private final WorkflowDefinitionRepository repository;
    private final JsonMapper jsonMapper;

    private volatile Map<String, WorkflowModel> models = Map.of();

    public WorkflowDefinitionStore(WorkflowDefinitionRepository repository, JsonMapper jsonMapper) {
        this.repository = repository;
        this.jsonMapper = jsonMapper;
    }

    /**
     * Rebuilds the cache from every persisted definition.
     */
    @Transactional(readOnly = true)
    public synchronized void reload() {
        Map<String, WorkflowModel> loaded = new HashMap<>();
        for (WorkflowDefinition definition : repository.findAll()) {
            try {
                WorkflowDefinitionDto dto = jsonMapper.readValue(definition.getDefinitionJson(), WorkflowDefinitionDto.class);
                loaded.put(definition.getWorkflowType(), WorkflowModel.compile(dto, definition.getDefinitionVersion()));
            } catch (JacksonException e) {
                throw new IllegalStateException("Failed to deserialize workflow definition " + definition.getWorkflowType(), e);
            }
        }
        models = Map.copyOf(loaded);
        log.info("Loaded {} workflow definition(s): {}", loaded.size(), loaded.keySet());
    }

    /**
     * Publishes a compiled model, replacing any previous model of the same type.
     */
    public synchronized void register(WorkflowModel model) {
        Map<String, WorkflowModel> next = new HashMap<>(models);
        next.put(model.workflowType(), model);
        models = Map.copyOf(next);
        log.debug("Registered workflowType={} definitionVersion={}", model.workflowType(), model.definitionVersion());
    }

    public WorkflowModel getModel(String workflowType) {
        WorkflowModel model = workflowType != null ? models.get(workflowType) : null;
        if (model == null) {
            throw new UnknownWorkflowException(workflowType);
        }
        return model;
    }

    public Set<String> workflowTypes() {
        return models.keySet();
    }

    public Set<TransitionRule> getTransitions(String workflowType, String fromState) {
        WorkflowModel model = requireState(workflowType, fromState);
        return new LinkedHashSet<>(model.transitionsFrom(fromState));
    }

    public boolean isTerminal(String workflowType, String state) {
        return requireState(workflowType, state).isTerminal(state);
    }

    public String getInitialState(String workflowType) {
        return getModel(workflowType).initialState();
    }

    public Set<String> getNotificationTargets(String workflowType, String state) {
        return requireState(workflowType, state).notificationTargets(state);
    }

    private WorkflowModel requireState(String workflowType, String state) {
        WorkflowModel model = getModel(workflowType);
        if (!model.declares(state)) {
            throw new UnknownStateException(workflowType, state);
        }
        return model;
    }
}
