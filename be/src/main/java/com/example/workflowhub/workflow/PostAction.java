package com.example.workflowhub.workflow;

import java.util.Objects;
import java.util.Optional;

/**
 * A directive executed after a transition has been applied: {@code notify:<collaborator>} or
 * {@code sync:external}.
 */
public record PostAction(Type type, String target) {

    public static final String SYNC_EXTERNAL = "sync:external";

    public enum Type {
        NOTIFY,
        SYNC
    }

    public PostAction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
    }

    public static Optional<PostAction> parse(String directive) {
        if (directive == null) {
            return Optional.empty();
        }
        String trimmed = directive.trim();
        if (SYNC_EXTERNAL.equals(trimmed)) {
            return Optional.of(new PostAction(Type.SYNC, "external"));
        }
        if (trimmed.startsWith("notify:") && trimmed.length() > "notify:".length()) {
            return Optional.of(new PostAction(Type.NOTIFY, trimmed.substring("notify:".length())));
        }
        return Optional.empty();
    }

    public String directive() {
        return type == Type.SYNC ? SYNC_EXTERNAL : "notify:" + target;
    }
}
