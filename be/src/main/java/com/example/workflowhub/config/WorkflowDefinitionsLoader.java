package com.example.workflowhub.config;

import com.example.workflowhub.api.v1.dto.WorkflowDefinitionDto;
import com.example.workflowhub.repository.WorkflowDefinitionRepository;
import com.example.workflowhub.service.WorkflowDefinitionService;
import com.example.workflowhub.service.WorkflowDefinitionStore;
import com.example.workflowhub.validation.WorkflowDefinitionValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Fills the definition store at startup: first from the database, then from the definitions shipped on the
 * classpath. A shipped definition that differs from the stored one replaces it (new definition version).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowDefinitionsLoader implements ApplicationRunner {

    private static final String WORKFLOWS_DIR = "workflows/";
    private static final List<String> WORKFLOW_FILES = List.of(
            "gallery-exhibit.json",
            "wellness-booking.json"
    );

    private final WorkflowDefinitionRepository repository;
    private final WorkflowDefinitionService service;
    private final WorkflowDefinitionStore store;
    private final JsonMapper jsonMapper;

    @Override
    public void run(ApplicationArguments args) {
        store.reload();
        for (String filename : WORKFLOW_FILES) {
            loadDefinition(WORKFLOWS_DIR + filename);
        }
    }

    private void loadDefinition(String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Workflow definition resource not found: {}", path);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            WorkflowDefinitionDto definition = jsonMapper.readValue(in, WorkflowDefinitionDto.class);
            if (repository.findByWorkflowType(definition.workflowType()).isPresent()
                    && definition.equals(service.findByType(definition.workflowType()).definition())) {
                log.info("Workflow definition unchanged: {}", definition.workflowType());
                return;
            }
            service.save(definition.workflowType(), definition);
            log.info("Loaded workflow definition: {}", definition.workflowType());
        } catch (WorkflowDefinitionValidationException e) {
            log.error("Invalid workflow definition {}: {}", path, e.getErrors());
        } catch (JacksonException e) {
            log.error("Failed to parse workflow definition {}: {}", path, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read workflow definition {}: {}", path, e.getMessage());
        }
    }
}
