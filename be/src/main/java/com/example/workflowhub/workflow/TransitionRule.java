package com.example.workflowhub.workflow;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A declared, directed edge of a workflow, compiled from its definition.
 */
public record TransitionRule(
        String from,
        String to,
        String trigger,
        List<Precondition> preconditions,
        Set<String> permittedActors,
        List<PostAction> postActions,
        boolean auditRequired
) {

    public TransitionRule {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        preconditions = preconditions != null ? List.copyOf(preconditions) : List.of();
        permittedActors = permittedActors != null ? Set.copyOf(permittedActors) : Set.of();
        postActions = postActions != null ? List.copyOf(postActions) : List.of();
    }

    public boolean restrictsActors() {
        return !permittedActors.isEmpty();
    }

    public boolean syncsExternally() {
        return postActions.stream().anyMatch(a -> a.type() == PostAction.Type.SYNC);
    }

    public Set<String> notifiedCollaborators() {
        return postActions.stream()
                .filter(a -> a.type() == PostAction.Type.NOTIFY)
                .map(PostAction::target)
                .collect(Collectors.toUnmodifiableSet());
    }
}
