package com.example.workflowhub.security;

import com.example.workflowhub.api.ActorNotPermittedException;

/**
 * Role names with a fixed meaning in the hub.
 */
public final class Roles {

    /** May read and edit workflow definitions and read webhook logs. */
    public static final String ADMIN = "admin";

    private Roles() {
    }

    public static void requireAdmin(Actor actor) {
        if (actor == null || !actor.hasRole(ADMIN)) {
            throw new ActorNotPermittedException("Role '" + ADMIN + "' required");
        }
    }
}
