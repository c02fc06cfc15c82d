package com.example.workflowhub.api.v1;

import com.example.workflowhub.service.WorkflowDefinitionStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check endpoint for the hub.
 * <p>
 * GET /api/v1/health returns 200 with status, service name and the number of loaded workflow types.
 * It needs no bearer token.
 * </p>
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final WorkflowDefinitionStore definitionStore;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.trace("Health check");
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "workflow-hub-be",
                "workflows", definitionStore.workflowTypes().size()));
    }
}
