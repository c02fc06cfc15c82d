package com.example.workflowhub.api.v1;

import com.example.workflowhub.support.HubTestConfig;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(HubTestConfig.class)
@DisplayName("Entity and workflow API")
class EntityControllerIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP = new ParameterizedTypeReference<>() { };

    private static final String ADMIN = "admin-token";
    private static final String CURATOR = "curator-token";
    private static final String BOOKING_AGENT = "booking-token";
    private static final String VIEWER = "viewer-token";

    @LocalServerPort
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private ResponseEntity<Map<String, Object>> call(HttpMethod method, String path, String token, String json) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return restTemplate.exchange(url(path), method, new HttpEntity<>(json, headers), JSON_MAP);
    }

    private String createExhibit(String title) {
        ResponseEntity<Map<String, Object>> created = call(HttpMethod.POST, "/api/v1/entities", CURATOR, """
                { "workflowType": "GalleryExhibit", "payload": { "title": "%s" } }
                """.formatted(title));
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return (String) created.getBody().get("id");
    }

    private ResponseEntity<Map<String, Object>> transition(String id, String toState, String token) {
        return call(HttpMethod.POST, "/api/v1/entities/" + id + "/transitions", token,
                "{ \"toState\": \"" + toState + "\" }");
    }

    @Nested
    @DisplayName("authentication")
    class Authentication {

        @Test
        @DisplayName("rejects requests without a bearer token")
        void missingToken() {
            ResponseEntity<Map<String, Object>> response = call(HttpMethod.GET, "/api/v1/entities/" + UUID.randomUUID(), null, null);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            assertThat(response.getBody()).containsEntry("code", "Unauthenticated");
        }

        @Test
        @DisplayName("rejects an unknown token")
        void unknownToken() {
            ResponseEntity<Map<String, Object>> response = call(HttpMethod.GET, "/api/v1/workflows", "forged", null);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        }

        @Test
        @DisplayName("leaves the health endpoint open")
        void healthIsOpen() {
            ResponseEntity<Map<String, Object>> response = call(HttpMethod.GET, "/api/v1/health", null, null);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(response.getBody()).containsEntry("status", "UP").containsEntry("service", "workflow-hub-be");
            assertThat(((Number) response.getBody().get("workflows")).intValue()).isGreaterThanOrEqualTo(2);
        }
    }

    @Nested
    @DisplayName("entities")
    class Entities {

        @Test
        @DisplayName("creates an entity in the initial state and returns 201")
        void create() {
            ResponseEntity<Map<String, Object>> created = call(HttpMethod.POST, "/api/v1/entities", CURATOR, """
                    { "workflowType": "GalleryExhibit", "payload": { "title": "Dunes", "rooms": 2 } }
                    """);

            assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
            assertThat(created.getBody())
                    .containsEntry("workflowType", "GalleryExhibit")
                    .containsEntry("state", "proposed")
                    .containsEntry("version", 0)
                    .containsKey("correlationId");

            ResponseEntity<Map<String, Object>> loaded = call(HttpMethod.GET, "/api/v1/entities/" + created.getBody().get("id"), CURATOR, null);
            assertThat(loaded.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(loaded.getBody()).containsEntry("payload", Map.of("title", "Dunes", "rooms", 2));
        }

        @Test
        @DisplayName("maps creation rejections to status codes")
        void createRejections() {
            assertThat(call(HttpMethod.POST, "/api/v1/entities", CURATOR, "{ \"workflowType\": \"Submarine\" }")
                    .getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            ResponseEntity<Map<String, Object>> wrongState = call(HttpMethod.POST, "/api/v1/entities", CURATOR,
                    "{ \"workflowType\": \"GalleryExhibit\", \"state\": \"active\" }");
            assertThat(wrongState.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_CONTENT);
            assertThat(wrongState.getBody()).containsEntry("code", "InvalidCreationState");
            ResponseEntity<Map<String, Object>> missingType = call(HttpMethod.POST, "/api/v1/entities", CURATOR, "{ }");
            assertThat(missingType.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(missingType.getBody()).containsEntry("code", "ValidationFailed");
        }

        @Test
        @DisplayName("applies a legal transition and rejects an illegal one with 422")
        void transitions() {
            String id = createExhibit("Mirrors");

            ResponseEntity<Map<String, Object>> skip = transition(id, "active", CURATOR);
            assertThat(skip.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_CONTENT);
            assertThat(skip.getBody())
                    .containsEntry("code", "NoSuchTransition")
                    .containsEntry("message", "no_such_transition:proposed->active");

            ResponseEntity<Map<String, Object>> review = transition(id, "reviewed", CURATOR);
            assertThat(review.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(review.getBody()).containsEntry("state", "reviewed").containsEntry("version", 1);
        }

        @Test
        @DisplayName("returns 403 when the actor may not take the transition")
        void forbiddenActor() {
            String id = createExhibit("Echoes");

            ResponseEntity<Map<String, Object>> response = transition(id, "reviewed", BOOKING_AGENT);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
            assertThat(response.getBody()).containsEntry("code", "ActorNotPermitted");
        }

        @Test
        @DisplayName("returns 400 for an undeclared target state and 404 for an unknown entity")
        void unknownTargets() {
            String id = createExhibit("Threads");

            assertThat(transition(id, "demolished", CURATOR).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            ResponseEntity<Map<String, Object>> missing = transition(UUID.randomUUID().toString(), "reviewed", CURATOR);
            assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(missing.getBody()).containsEntry("code", "EntityNotFound");
            assertThat(call(HttpMethod.GET, "/api/v1/entities/not-a-uuid", CURATOR, null).getStatusCode())
                    .isEqualTo(HttpStatus.BAD_REQUEST);
        }

        @Test
        @DisplayName("lists every attempt in the audit trail")
        @SuppressWarnings("unchecked")
        void auditTrail() {
            String id = createExhibit("Paper Moons");
            transition(id, "archived", CURATOR);
            transition(id, "reviewed", CURATOR);

            ResponseEntity<Map<String, Object>> audit = call(HttpMethod.GET, "/api/v1/entities/" + id + "/audit", CURATOR, null);

            assertThat(audit.getStatusCode()).isEqualTo(HttpStatus.OK);
            List<Map<String, Object>> records = (List<Map<String, Object>>) audit.getBody().get("records");
            assertThat(records).extracting(r -> r.get("outcome")).containsExactly("APPLIED", "REJECTED", "APPLIED");
            assertThat(records.get(1)).containsEntry("reason", "NoSuchTransition").containsEntry("actor", "curator");
        }
    }

    @Nested
    @DisplayName("workflow administration")
    class WorkflowAdministration {

        private static final String DEFINITION = """
                {
                  "workflowType": "%s",
                  "description": "Loan of an artwork to another venue",
                  "states": ["requested", "approved", "returned"],
                  "initialState": "requested",
                  "terminalStates": ["returned"],
                  "transitions": [
                    { "from": "requested", "to": "approved", "trigger": "approve", "permittedActors": ["curator"],
                      "postActions": ["notify:marketing"] },
                    { "from": "approved", "to": "returned", "trigger": "return" }
                  ],
                  "notificationTargets": { "approved": ["curator-desk"] }
                }
                """;

        @Test
        @DisplayName("is admin only")
        void adminOnly() {
            ResponseEntity<Map<String, Object>> response = call(HttpMethod.GET, "/api/v1/workflows", VIEWER, null);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
            assertThat(response.getBody()).containsEntry("code", "ActorNotPermitted");
        }

        @Test
        @DisplayName("lists the shipped workflows")
        @SuppressWarnings("unchecked")
        void list() {
            ResponseEntity<Map<String, Object>> response = call(HttpMethod.GET, "/api/v1/workflows", ADMIN, null);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            List<Map<String, Object>> workflows = (List<Map<String, Object>>) response.getBody().get("workflows");
            assertThat(workflows).extracting(w -> w.get("workflowType")).contains("GalleryExhibit", "WellnessBooking");
        }

        @Test
        @DisplayName("rejects an invalid definition with every error")
        @SuppressWarnings("unchecked")
        void invalidDefinition() {
            ResponseEntity<Map<String, Object>> response = call(HttpMethod.PUT, "/api/v1/workflows/Broken", ADMIN, """
                    {
                      "workflowType": "Broken",
                      "states": ["a", "b"],
                      "initialState": "c",
                      "transitions": [ { "from": "a", "to": "z", "postActions": ["notify:nobody"] } ]
                    }
                    """);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(response.getBody()).containsEntry("code", "InvalidDefinition");
            List<Map<String, Object>> errors = (List<Map<String, Object>>) response.getBody().get("errors");
            assertThat(errors).extracting(e -> e.get("field"))
                    .contains("initialState", "transitions[0].to", "transitions[0].postActions");
        }

        @Test
        @DisplayName("stores a new definition, bumps its version on replace and serves it at once")
        void saveAndReplace() {
            String type = "ArtLoan" + UUID.randomUUID().toString().substring(0, 8);

            ResponseEntity<Map<String, Object>> first = call(HttpMethod.PUT, "/api/v1/workflows/" + type, ADMIN, DEFINITION.formatted(type));
            ResponseEntity<Map<String, Object>> second = call(HttpMethod.PUT, "/api/v1/workflows/" + type, ADMIN, DEFINITION.formatted(type));

            assertThat(first.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(first.getBody()).containsEntry("definitionVersion", 1);
            assertThat(second.getBody()).containsEntry("definitionVersion", 2);
            assertThat(call(HttpMethod.GET, "/api/v1/workflows/" + type, ADMIN, null).getBody())
                    .containsEntry("workflowType", type);

            ResponseEntity<Map<String, Object>> created = call(HttpMethod.POST, "/api/v1/entities", CURATOR,
                    "{ \"workflowType\": \"" + type + "\" }");
            assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
            assertThat(created.getBody()).containsEntry("state", "requested");
        }

        @Test
        @DisplayName("refuses to drop a state that existing entities occupy")
        @SuppressWarnings("unchecked")
        void occupiedStateCannotBeRemoved() {
            String type = "ArtLoan" + UUID.randomUUID().toString().substring(0, 8);
            assertThat(call(HttpMethod.PUT, "/api/v1/workflows/" + type, ADMIN, DEFINITION.formatted(type))
                    .getStatusCode()).isEqualTo(HttpStatus.OK);
            String id = (String) call(HttpMethod.POST, "/api/v1/entities", CURATOR,
                    "{ \"workflowType\": \"" + type + "\" }").getBody().get("id");
            assertThat(transition(id, "approved", CURATOR).getStatusCode()).isEqualTo(HttpStatus.OK);

            ResponseEntity<Map<String, Object>> response = call(HttpMethod.PUT, "/api/v1/workflows/" + type, ADMIN, """
                    {
                      "workflowType": "%s",
                      "states": ["requested", "returned"],
                      "initialState": "requested",
                      "terminalStates": ["returned"],
                      "transitions": [ { "from": "requested", "to": "returned", "trigger": "return" } ]
                    }
                    """.formatted(type));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(response.getBody()).containsEntry("code", "InvalidDefinition");
            List<Map<String, Object>> errors = (List<Map<String, Object>>) response.getBody().get("errors");
            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e).containsEntry("field", "states");
                assertThat((String) e.get("message")).endsWith(": approved");
            });
            assertThat(call(HttpMethod.GET, "/api/v1/workflows/" + type, ADMIN, null).getBody())
                    .containsEntry("definitionVersion", 1);
            assertThat(transition(id, "returned", CURATOR).getStatusCode()).isEqualTo(HttpStatus.OK);
        }

        @Test
        @DisplayName("rejects a body whose workflow type differs from the path")
        void pathMismatch() {
            ResponseEntity<Map<String, Object>> response = call(HttpMethod.PUT, "/api/v1/workflows/Other", ADMIN,
                    DEFINITION.formatted("ArtLoan"));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(response.getBody()).containsEntry("code", "InvalidDefinition");
        }

        @Test
        @DisplayName("returns 404 for an unknown workflow type")
        void unknownType() {
            assertThat(call(HttpMethod.GET, "/api/v1/workflows/Submarine", ADMIN, null).getStatusCode())
                    .isEqualTo(HttpStatus.NOT_FOUND);
        }
    }
}
