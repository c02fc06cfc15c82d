package com.example.workflowhub.service;

import com.example.workflowhub.security.Actor;
import com.example.workflowhub.support.WorkflowFixtures;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TransitionValidator")
class TransitionValidatorTest {

    private static final Actor CURATOR = new Actor("alice", Set.of("curator"));
    private static final Actor VIEWER = new Actor("bob", Set.of());
    private static final Map<String, Object> TITLED = Map.of("title", "Light & Shadow");

    private final TransitionValidator validator = new TransitionValidator(WorkflowFixtures.storeWithShippedDefinitions());

    @Nested
    @DisplayName("creation path")
    class Creation {

        @Test
        @DisplayName("allows creation in the initial state")
        void initialStateAllowed() {
            TransitionDecision decision = validator.validate("GalleryExhibit", null, "proposed", CURATOR, Map.of());
            assertThat(decision.allowed()).isTrue();
            assertThat(decision.rule()).isNull();
        }

        @Test
        @DisplayName("rejects creation in any other state, declared or not")
        void otherStateRejected() {
            assertThat(validator.validate("GalleryExhibit", null, "active", CURATOR, Map.of()).code())
                    .isEqualTo(TransitionErrorCode.INVALID_CREATION_STATE);
            assertThat(validator.validate("GalleryExhibit", null, "nowhere", CURATOR, Map.of()).code())
                    .isEqualTo(TransitionErrorCode.INVALID_CREATION_STATE);
        }
    }

    @Nested
    @DisplayName("check order")
    class CheckOrder {

        @Test
        @DisplayName("unknown workflow comes first")
        void unknownWorkflow() {
            assertThat(validator.validate("Nope", "proposed", "reviewed", CURATOR, TITLED).code())
                    .isEqualTo(TransitionErrorCode.UNKNOWN_WORKFLOW);
        }

        @Test
        @DisplayName("undeclared target state is UnknownState")
        void unknownState() {
            TransitionDecision decision = validator.validate("GalleryExhibit", "proposed", "demolished", CURATOR, TITLED);
            assertThat(decision.code()).isEqualTo(TransitionErrorCode.UNKNOWN_STATE);
            assertThat(decision.detail()).isEqualTo("unknown_state:demolished");
        }

        @Test
        @DisplayName("terminal source wins over a missing edge")
        void terminated() {
            assertThat(validator.validate("GalleryExhibit", "archived", "proposed", CURATOR, TITLED).code())
                    .isEqualTo(TransitionErrorCode.WORKFLOW_TERMINATED);
            assertThat(validator.validate("GalleryExhibit", "archived", "archived", CURATOR, TITLED).code())
                    .isEqualTo(TransitionErrorCode.WORKFLOW_TERMINATED);
        }

        @Test
        @DisplayName("no declared edge is NoSuchTransition, even for a permitted actor")
        void noSuchTransition() {
            TransitionDecision decision = validator.validate("GalleryExhibit", "proposed", "scheduled", CURATOR, TITLED);
            assertThat(decision.code()).isEqualTo(TransitionErrorCode.NO_SUCH_TRANSITION);
            assertThat(decision.detail()).isEqualTo("no_such_transition:proposed->scheduled");
        }

        @Test
        @DisplayName("actor check precedes preconditions")
        void actorBeforePreconditions() {
            assertThat(validator.validate("GalleryExhibit", "proposed", "reviewed", VIEWER, Map.of()).code())
                    .isEqualTo(TransitionErrorCode.ACTOR_NOT_PERMITTED);
        }

        @Test
        @DisplayName("first failing precondition is reported with its detail")
        void preconditionFailed() {
            TransitionDecision decision = validator.validate("GalleryExhibit", "proposed", "reviewed", CURATOR, Map.of());
            assertThat(decision.code()).isEqualTo(TransitionErrorCode.PRECONDITION_FAILED);
            assertThat(decision.detail()).isEqualTo("precondition_failed:title:present");
        }
    }

    @Nested
    @DisplayName("allowed transitions")
    class Allowed {

        @Test
        @DisplayName("returns the matched rule")
        void returnsRule() {
            TransitionDecision decision = validator.validate("GalleryExhibit", "proposed", "reviewed", CURATOR, TITLED);
            assertThat(decision.allowed()).isTrue();
            assertThat(decision.rule().from()).isEqualTo("proposed");
            assertThat(decision.rule().to()).isEqualTo("reviewed");
        }

        @Test
        @DisplayName("a rule without actor restriction accepts any authenticated actor")
        void unrestrictedRuleAllowsAnyActor() {
            assertThat(validator.validate("GalleryExhibit", "active", "archived", VIEWER, Map.of()).allowed()).isTrue();
        }
    }
}
