package com.example.workflowhub.api.v1;

import com.example.workflowhub.api.v1.dto.WorkflowDefinitionDto;
import com.example.workflowhub.api.v1.dto.WorkflowDefinitionResponse;
import com.example.workflowhub.api.v1.dto.WorkflowListResponse;
import com.example.workflowhub.security.Actor;
import com.example.workflowhub.security.ActorAuthenticationFilter;
import com.example.workflowhub.security.Roles;
import com.example.workflowhub.service.WorkflowDefinitionService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative REST controller for workflow definitions: list (GET), get by type (GET /{type}) and
 * create or replace (PUT /{type}). Requires the {@value Roles#ADMIN} role.
 */
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowDefinitionController {

    private final WorkflowDefinitionService service;

    @GetMapping
    public ResponseEntity<WorkflowListResponse> list(@RequestAttribute(ActorAuthenticationFilter.ACTOR_ATTRIBUTE) Actor actor) {
        Roles.requireAdmin(actor);
        log.debug("Listing workflow definitions");
        return ResponseEntity.ok(new WorkflowListResponse(service.findAll()));
    }

    @GetMapping("/{workflowType}")
    public ResponseEntity<WorkflowDefinitionResponse> getByType(@RequestAttribute(ActorAuthenticationFilter.ACTOR_ATTRIBUTE) Actor actor,
                                                                @PathVariable String workflowType) {
        Roles.requireAdmin(actor);
        log.debug("Getting workflow definition workflowType={}", workflowType);
        return ResponseEntity.ok(service.findByType(workflowType));
    }

    @PutMapping("/{workflowType}")
    public ResponseEntity<WorkflowDefinitionResponse> save(@RequestAttribute(ActorAuthenticationFilter.ACTOR_ATTRIBUTE) Actor actor,
                                                           @PathVariable String workflowType,
                                                           @Valid @RequestBody WorkflowDefinitionDto definition) {
        Roles.requireAdmin(actor);
        log.info("Saving workflow definition workflowType={} actor={} states={}", workflowType, actor.id(),
                definition.states() != null ? definition.states().size() : 0);
        return ResponseEntity.ok(service.save(workflowType, definition));
    }
}
