package com.example.workflowhub.workflow;

import com.example.workflowhub.api.v1.dto.PreconditionDto;
import com.example.workflowhub.api.v1.dto.TransitionDto;
import com.example.workflowhub.api.v1.dto.WorkflowDefinitionDto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, compiled view of one workflow definition: declared states, initial and terminal states,
 * transitions grouped by source state, and notification targets per state.
 * <p>
 * Built only from definitions that passed {@link com.example.workflowhub.validation.WorkflowDefinitionValidator};
 * safe to share between threads.
 * </p>
 */
public final class WorkflowModel {

    private final String workflowType;
    private final int definitionVersion;
    private final Set<String> states;
    private final String initialState;
    private final Set<String> terminalStates;
    private final Map<String, List<TransitionRule>> transitionsByFrom;
    private final Map<String, Set<String>> notificationTargets;

    private WorkflowModel(String workflowType,
                          int definitionVersion,
                          Set<String> states,
                          String initialState,
                          Set<String> terminalStates,
                          Map<String, List<TransitionRule>> transitionsByFrom,
                          Map<String, Set<String>> notificationTargets) {
        this.workflowType = workflowType;
        this.definitionVersion = definitionVersion;
        this.states = states;
        this.initialState = initialState;
        this.terminalStates = terminalStates;
        this.transitionsByFrom = transitionsByFrom;
        this.notificationTargets = notificationTargets;
    }

    public static WorkflowModel compile(WorkflowDefinitionDto definition, int definitionVersion) {
        Set<String> states = new LinkedHashSet<>(definition.states());

        Map<String, List<TransitionRule>> byFrom = new LinkedHashMap<>();
        for (String state : states) {
            byFrom.put(state, new ArrayList<>());
        }
        if (definition.transitions() != null) {
            for (TransitionDto dto : definition.transitions()) {
                byFrom.get(dto.from()).add(toRule(dto));
            }
        }

        Set<String> terminal = new LinkedHashSet<>();
        for (String state : states) {
            if (byFrom.get(state).isEmpty()) {
                terminal.add(state);
            }
        }

        Map<String, List<TransitionRule>> frozenTransitions = new LinkedHashMap<>();
        byFrom.forEach((state, rules) -> frozenTransitions.put(state, List.copyOf(rules)));

        Map<String, Set<String>> targets = new LinkedHashMap<>();
        if (definition.notificationTargets() != null) {
            definition.notificationTargets().forEach((state, collaborators) ->
                    targets.put(state, collaborators != null ? Set.copyOf(collaborators) : Set.of()));
        }

        return new WorkflowModel(
                definition.workflowType(),
                definitionVersion,
                Set.copyOf(states),
                definition.initialState(),
                Set.copyOf(terminal),
                Map.copyOf(frozenTransitions),
                Map.copyOf(targets)
        );
    }

    private static TransitionRule toRule(TransitionDto dto) {
        List<Precondition> preconditions = new ArrayList<>();
        if (dto.preconditions() != null) {
            for (PreconditionDto p : dto.preconditions()) {
                preconditions.add(new Precondition(
                        p.field(),
                        PreconditionOperator.parse(p.operator()).orElseThrow(),
                        p.value(),
                        p.values()));
            }
        }
        List<PostAction> postActions = new ArrayList<>();
        if (dto.postActions() != null) {
            for (String directive : dto.postActions()) {
                postActions.add(PostAction.parse(directive).orElseThrow());
            }
        }
        return new TransitionRule(
                dto.from(),
                dto.to(),
                dto.trigger(),
                preconditions,
                dto.permittedActors() != null ? Set.copyOf(dto.permittedActors()) : Set.of(),
                postActions,
                dto.auditRequired() == null || dto.auditRequired()
        );
    }

    public String workflowType() {
        return workflowType;
    }

    public int definitionVersion() {
        return definitionVersion;
    }

    public Set<String> states() {
        return states;
    }

    public String initialState() {
        return initialState;
    }

    public boolean declares(String state) {
        return state != null && states.contains(state);
    }

    public boolean isTerminal(String state) {
        return terminalStates.contains(state);
    }

    public List<TransitionRule> transitionsFrom(String state) {
        return transitionsByFrom.getOrDefault(state, List.of());
    }

    public Optional<TransitionRule> transition(String from, String to) {
        return transitionsFrom(from).stream()
                .filter(rule -> rule.to().equals(to))
                .findFirst();
    }

    public Set<String> notificationTargets(String state) {
        return notificationTargets.getOrDefault(state, Set.of());
    }
}
