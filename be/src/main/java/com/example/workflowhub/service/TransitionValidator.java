package com.example.workflowhub.service;

import com.example.workflowhub.api.UnknownWorkflowException;
import com.example.workflowhub.security.Actor;
import com.example.workflowhub.workflow.Precondition;
import com.example.workflowhub.workflow.TransitionRule;
import com.example.workflowhub.workflow.WorkflowModel;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a requested state change is legal. Reads only the definition store.
 * <p>
 * Checks run in a fixed order and the first failure wins: unknown workflow, creation into a non-initial
 * state, undeclared states, terminal source state, missing edge, actor not permitted, failing precondition.
 * A {@code null} {@code fromState} denotes the creation of a new entity.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class TransitionValidator {

    private final WorkflowDefinitionStore definitionStore;

    public TransitionDecision validate(String workflowType, String fromState, String toState,
                                       Actor actor, Map<String, Object> payload) {
        WorkflowModel model;
        try {
            model = definitionStore.getModel(workflowType);
        } catch (UnknownWorkflowException e) {
            return TransitionDecision.deny(TransitionErrorCode.UNKNOWN_WORKFLOW, "unknown_workflow:" + workflowType);
        }

        if (fromState == null) {
            if (toState != null && toState.equals(model.initialState())) {
                return TransitionDecision.allow(null);
            }
            return TransitionDecision.deny(TransitionErrorCode.INVALID_CREATION_STATE,
                    "invalid_creation_state:" + toState + ":expected:" + model.initialState());
        }

        if (!model.declares(fromState)) {
            return TransitionDecision.deny(TransitionErrorCode.UNKNOWN_STATE, "unknown_state:" + fromState);
        }
        if (!model.declares(toState)) {
            return TransitionDecision.deny(TransitionErrorCode.UNKNOWN_STATE, "unknown_state:" + toState);
        }
        if (model.isTerminal(fromState)) {
            return TransitionDecision.deny(TransitionErrorCode.WORKFLOW_TERMINATED, "workflow_terminated:" + fromState);
        }

        Optional<TransitionRule> match = model.transition(fromState, toState);
        if (match.isEmpty()) {
            return TransitionDecision.deny(TransitionErrorCode.NO_SUCH_TRANSITION,
                    "no_such_transition:" + fromState + "->" + toState);
        }
        TransitionRule rule = match.get();

        if (rule.restrictsActors() && (actor == null || !actor.matchesAny(rule.permittedActors()))) {
            return TransitionDecision.deny(TransitionErrorCode.ACTOR_NOT_PERMITTED,
                    "actor_not_permitted:" + (actor != null ? actor.id() : "anonymous"));
        }

        for (Precondition precondition : rule.preconditions()) {
            if (!precondition.test(payload, actor)) {
                return TransitionDecision.deny(TransitionErrorCode.PRECONDITION_FAILED, precondition.failureDetail());
            }
        }
        return TransitionDecision.allow(rule);
    }
}
