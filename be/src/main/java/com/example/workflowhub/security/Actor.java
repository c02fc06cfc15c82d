package com.example.workflowhub.security;

import java.util.Objects;
import java.util.Set;

/**
 * An authenticated identity acting on entities: a user resolved from a bearer token, or the
 * system actor of a verified webhook source.
 */
public record Actor(String id, Set<String> roles) {

    public Actor {
        Objects.requireNonNull(id, "id");
        roles = roles != null ? Set.copyOf(roles) : Set.of();
    }

    public static Actor webhookSource(String source, Set<String> roles) {
        return new Actor("webhook:" + source, roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    /**
     * True when this actor is named by, or holds a role named by, one of the given identifiers.
     */
    public boolean matchesAny(Set<String> identifiers) {
        if (identifiers.contains(id)) {
            return true;
        }
        for (String role : roles) {
            if (identifiers.contains(role)) {
                return true;
            }
        }
        return false;
    }
}
