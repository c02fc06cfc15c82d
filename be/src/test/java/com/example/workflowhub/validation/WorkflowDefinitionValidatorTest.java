package com.example.workflowhub.validation;

import com.example.workflowhub.api.v1.dto.PreconditionDto;
import com.example.workflowhub.api.v1.dto.TransitionDto;
import com.example.workflowhub.api.v1.dto.WorkflowDefinitionDto;
import com.example.workflowhub.support.WorkflowFixtures;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.workflowhub.support.WorkflowFixtures.COLLABORATORS;
import static com.example.workflowhub.support.WorkflowFixtures.definition;
import static com.example.workflowhub.support.WorkflowFixtures.transition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("WorkflowDefinitionValidator")
class WorkflowDefinitionValidatorTest {

    @Nested
    @DisplayName("valid definition")
    class ValidDefinition {

        @Test
        @DisplayName("accepts the shipped GalleryExhibit and WellnessBooking definitions")
        void shippedDefinitionsPass() {
            assertDoesNotThrow(() -> WorkflowDefinitionValidator.validate(WorkflowFixtures.galleryExhibit(), COLLABORATORS));
            assertDoesNotThrow(() -> WorkflowDefinitionValidator.validate(WorkflowFixtures.wellnessBooking(), COLLABORATORS));
        }

        @Test
        @DisplayName("accepts a single-state workflow without transitions")
        void singleStatePasses() {
            WorkflowDefinitionDto dto = definition("Single", List.of("only"), "only", null, null);
            assertDoesNotThrow(() -> WorkflowDefinitionValidator.validate(dto, COLLABORATORS));
        }
    }

    @Nested
    @DisplayName("invalid definition")
    class InvalidDefinition {

        @Test
        @DisplayName("fails when the initial state is not declared")
        void undeclaredInitialState() {
            WorkflowDefinitionDto dto = definition("Flow", List.of("a", "b"), "z", List.of(transition("a", "b")), null);
            WorkflowDefinitionValidationException ex = assertThrows(WorkflowDefinitionValidationException.class,
                    () -> WorkflowDefinitionValidator.validate(dto, COLLABORATORS));
            assertThat(ex.getErrors()).extracting(ValidationError::field).containsExactly("initialState");
        }

        @Test
        @DisplayName("fails when a transition endpoint is not declared")
        void undeclaredEndpoint() {
            WorkflowDefinitionDto dto = definition("Flow", List.of("a", "b"), "a", List.of(transition("a", "c")), null);
            WorkflowDefinitionValidationException ex = assertThrows(WorkflowDefinitionValidationException.class,
                    () -> WorkflowDefinitionValidator.validate(dto, COLLABORATORS));
            assertThat(ex.getErrors()).extracting(ValidationError::field).containsExactly("transitions[0].to");
        }

        @Test
        @DisplayName("fails on self transitions and duplicate edges")
        void selfLoopAndDuplicateEdge() {
            WorkflowDefinitionDto dto = definition("Flow", List.of("a", "b"), "a",
                    List.of(transition("a", "a"), transition("a", "b"), transition("a", "b")), null);
            WorkflowDefinitionValidationException ex = assertThrows(WorkflowDefinitionValidationException.class,
                    () -> WorkflowDefinitionValidator.validate(dto, COLLABORATORS));
            assertThat(ex.getErrors()).hasSize(2);
            assertThat(ex.getErrors()).extracting(ValidationError::message)
                    .anyMatch(m -> m.contains("self transitions"))
                    .anyMatch(m -> m.contains("duplicate transition"));
        }

        @Test
        @DisplayName("fails when a declared terminal state has outgoing transitions")
        void terminalWithOutgoing() {
            WorkflowDefinitionDto dto = new WorkflowDefinitionDto("Flow", null, List.of("a", "b"), "a", List.of("a"),
                    List.of(transition("a", "b")), null);
            WorkflowDefinitionValidationException ex = assertThrows(WorkflowDefinitionValidationException.class,
                    () -> WorkflowDefinitionValidator.validate(dto, COLLABORATORS));
            assertThat(ex.getErrors()).extracting(ValidationError::field).containsExactly("terminalStates");
        }

        @Test
        @DisplayName("fails on unknown precondition operator and on missing operand")
        void badPreconditions() {
            TransitionDto withPreconditions = new TransitionDto("a", "b", "go",
                    List.of(new PreconditionDto("title", "looks_like", null, null),
                            new PreconditionDto("status", "equals", null, null)),
                    null, null, null);
            WorkflowDefinitionDto dto = definition("Flow", List.of("a", "b"), "a", List.of(withPreconditions), null);
            WorkflowDefinitionValidationException ex = assertThrows(WorkflowDefinitionValidationException.class,
                    () -> WorkflowDefinitionValidator.validate(dto, COLLABORATORS));
            assertThat(ex.getErrors()).extracting(ValidationError::field)
                    .containsExactly("transitions[0].preconditions[0].operator", "transitions[0].preconditions[1].value");
        }

        @Test
        @DisplayName("fails on unparseable post actions and unknown collaborators")
        void badPostActions() {
            TransitionDto withActions = new TransitionDto("a", "b", "go", null, null,
                    List.of("email:someone", "notify:nobody"), null);
            WorkflowDefinitionDto dto = definition("Flow", List.of("a", "b"), "a", List.of(withActions),
                    Map.of("b", List.of("ghost")));
            WorkflowDefinitionValidationException ex = assertThrows(WorkflowDefinitionValidationException.class,
                    () -> WorkflowDefinitionValidator.validate(dto, COLLABORATORS));
            assertThat(ex.getErrors()).hasSize(3);
            assertThat(ex.getErrors()).extracting(ValidationError::message)
                    .anyMatch(m -> m.startsWith("invalid post action 'email:someone'"))
                    .anyMatch(m -> m.equals("unknown collaborator: nobody"))
                    .anyMatch(m -> m.equals("unknown collaborator: ghost"));
        }

        @Test
        @DisplayName("fails when notification targets name an undeclared state")
        void notificationTargetForUndeclaredState() {
            WorkflowDefinitionDto dto = definition("Flow", List.of("a", "b"), "a", List.of(transition("a", "b")),
                    Map.of("c", List.of("marketing")));
            WorkflowDefinitionValidationException ex = assertThrows(WorkflowDefinitionValidationException.class,
                    () -> WorkflowDefinitionValidator.validate(dto, COLLABORATORS));
            assertThat(ex.getErrors()).extracting(ValidationError::field).containsExactly("notificationTargets[c]");
        }

        @Test
        @DisplayName("reports all problems at once")
        void reportsAllErrors() {
            WorkflowDefinitionDto dto = new WorkflowDefinitionDto(" ", null, List.of("a", "a"), "x", null,
                    List.of(transition("a", "y")), null);
            WorkflowDefinitionValidationException ex = assertThrows(WorkflowDefinitionValidationException.class,
                    () -> WorkflowDefinitionValidator.validate(dto, COLLABORATORS));
            assertThat(ex.getErrors()).extracting(ValidationError::field)
                    .contains("workflowType", "states", "initialState", "transitions[0].to");
        }
    }
}
