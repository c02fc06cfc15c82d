package com.example.workflowhub.validation;

import com.example.workflowhub.api.v1.dto.PreconditionDto;
import com.example.workflowhub.api.v1.dto.TransitionDto;
import com.example.workflowhub.api.v1.dto.WorkflowDefinitionDto;
import com.example.workflowhub.workflow.PostAction;
import com.example.workflowhub.workflow.PreconditionOperator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a workflow definition: declared states, transition endpoints, terminal states,
 * preconditions, post actions and collaborator references.
 */
public final class WorkflowDefinitionValidator {

    private WorkflowDefinitionValidator() {
    }

    /**
     * Validates the definition. Throws {@link WorkflowDefinitionValidationException} with all errors if invalid.
     *
     * @param knownCollaborators names accepted in {@code notify:} actions and notification targets
     */
    public static void validate(WorkflowDefinitionDto definition, Set<String> knownCollaborators) {
        List<ValidationError> errors = new ArrayList<>();

        if (definition == null) {
            errors.add(new ValidationError("definition", "definition is required"));
            throw new WorkflowDefinitionValidationException(errors);
        }
        if (definition.workflowType() == null || definition.workflowType().isBlank()) {
            errors.add(new ValidationError("workflowType", "workflowType is required"));
        }
        if (definition.states() == null || definition.states().isEmpty()) {
            errors.add(new ValidationError("states", "at least one state is required"));
            throw new WorkflowDefinitionValidationException(errors);
        }

        Set<String> states = new HashSet<>();
        for (String state : definition.states()) {
            if (state == null || state.isBlank()) {
                errors.add(new ValidationError("states", "state names must not be blank"));
            } else if (!states.add(state)) {
                errors.add(new ValidationError("states", "duplicate state: " + state));
            }
        }

        String initial = definition.initialState();
        if (initial == null || initial.isBlank()) {
            errors.add(new ValidationError("initialState", "initialState is required"));
        } else if (!states.contains(initial)) {
            errors.add(new ValidationError("initialState", "initialState must be a declared state: " + initial));
        }

        Set<String> statesWithOutgoing = new HashSet<>();
        Set<String> edges = new HashSet<>();
        List<TransitionDto> transitions = definition.transitions() != null ? definition.transitions() : List.of();
        for (int i = 0; i < transitions.size(); i++) {
            TransitionDto transition = transitions.get(i);
            String prefix = "transitions[" + i + "]";
            validateTransition(transition, prefix, states, knownCollaborators, errors);
            if (transition.from() != null && transition.to() != null) {
                statesWithOutgoing.add(transition.from());
                if (!edges.add(transition.from() + "->" + transition.to())) {
                    errors.add(new ValidationError(prefix, "duplicate transition " + transition.from() + " -> " + transition.to()));
                }
            }
        }

        if (definition.terminalStates() != null) {
            for (String terminal : definition.terminalStates()) {
                if (!states.contains(terminal)) {
                    errors.add(new ValidationError("terminalStates", "terminal state must be declared: " + terminal));
                } else if (statesWithOutgoing.contains(terminal)) {
                    errors.add(new ValidationError("terminalStates", "terminal state must not have outgoing transitions: " + terminal));
                }
            }
        }

        if (definition.notificationTargets() != null) {
            for (Map.Entry<String, List<String>> entry : definition.notificationTargets().entrySet()) {
                String field = "notificationTargets[" + entry.getKey() + "]";
                if (!states.contains(entry.getKey())) {
                    errors.add(new ValidationError(field, "notification target state must be declared: " + entry.getKey()));
                }
                if (entry.getValue() != null) {
                    for (String collaborator : entry.getValue()) {
                        if (!knownCollaborators.contains(collaborator)) {
                            errors.add(new ValidationError(field, "unknown collaborator: " + collaborator));
                        }
                    }
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new WorkflowDefinitionValidationException(errors);
        }
    }

    private static void validateTransition(TransitionDto transition, String prefix, Set<String> states,
                                           Set<String> knownCollaborators, List<ValidationError> errors) {
        if (transition.from() == null || !states.contains(transition.from())) {
            errors.add(new ValidationError(prefix + ".from", "from must be a declared state: " + transition.from()));
        }
        if (transition.to() == null || !states.contains(transition.to())) {
            errors.add(new ValidationError(prefix + ".to", "to must be a declared state: " + transition.to()));
        }
        if (transition.from() != null && transition.from().equals(transition.to())) {
            errors.add(new ValidationError(prefix, "self transitions are not allowed: " + transition.from()));
        }

        if (transition.preconditions() != null) {
            for (int j = 0; j < transition.preconditions().size(); j++) {
                validatePrecondition(transition.preconditions().get(j), prefix + ".preconditions[" + j + "]", errors);
            }
        }

        if (transition.postActions() != null) {
            for (String directive : transition.postActions()) {
                Optional<PostAction> action = PostAction.parse(directive);
                if (action.isEmpty()) {
                    errors.add(new ValidationError(prefix + ".postActions", "invalid post action '" + directive + "'; expected notify:<collaborator> or sync:external"));
                } else if (action.get().type() == PostAction.Type.NOTIFY && !knownCollaborators.contains(action.get().target())) {
                    errors.add(new ValidationError(prefix + ".postActions", "unknown collaborator: " + action.get().target()));
                }
            }
        }
    }

    private static void validatePrecondition(PreconditionDto precondition, String prefix, List<ValidationError> errors) {
        if (precondition.field() == null || precondition.field().isBlank()) {
            errors.add(new ValidationError(prefix + ".field", "field is required"));
        }
        Optional<PreconditionOperator> operator = PreconditionOperator.parse(precondition.operator());
        if (operator.isEmpty()) {
            errors.add(new ValidationError(prefix + ".operator", "invalid operator '" + precondition.operator() + "'; must be one of: present, absent, equals, not_equals, in"));
            return;
        }
        if (operator.get().requiresValue() && precondition.value() == null) {
            errors.add(new ValidationError(prefix + ".value", "value is required for operator " + operator.get().key()));
        }
        if (operator.get() == PreconditionOperator.IN && (precondition.values() == null || precondition.values().isEmpty())) {
            errors.add(new ValidationError(prefix + ".values", "values are required for operator in"));
        }
    }
}
