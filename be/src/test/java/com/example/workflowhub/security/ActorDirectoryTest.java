package com.example.workflowhub.security;

import com.example.workflowhub.api.ActorNotPermittedException;
import com.example.workflowhub.config.HubProperties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

@DisplayName("ActorDirectory")
class ActorDirectoryTest {

    @Test
    @DisplayName("resolves configured tokens and ignores entries without a token")
    void authenticate() {
        ActorDirectory directory = new ActorDirectory(properties(
                entry("curator", "t-curator", "curator"),
                entry("ghost", " ")));

        assertThat(directory.authenticate("t-curator")).hasValueSatisfying(actor -> {
            assertThat(actor.id()).isEqualTo("curator");
            assertThat(actor.roles()).containsExactly("curator");
        });
        assertThat(directory.authenticate("t-unknown")).isEmpty();
        assertThat(directory.authenticate(" ")).isEmpty();
        assertThat(directory.authenticate(null)).isEmpty();
    }

    @Test
    @DisplayName("refuses two actors sharing a token")
    void duplicateToken() {
        assertThatThrownBy(() -> new ActorDirectory(properties(entry("a", "same"), entry("b", "same"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("matches an actor by id or by role")
    void matchesAny() {
        Actor actor = new Actor("installer-1", Set.of("installer"));

        assertThat(actor.matchesAny(Set.of("curator", "installer"))).isTrue();
        assertThat(actor.matchesAny(Set.of("installer-1"))).isTrue();
        assertThat(actor.matchesAny(Set.of("curator"))).isFalse();
    }

    @Test
    @DisplayName("admin checks require the admin role")
    void requireAdmin() {
        assertDoesNotThrow(() -> Roles.requireAdmin(new Actor("root", Set.of(Roles.ADMIN))));
        assertThatThrownBy(() -> Roles.requireAdmin(new Actor("curator", Set.of("curator"))))
                .isInstanceOf(ActorNotPermittedException.class);
    }

    private static HubProperties properties(HubProperties.ActorEntry... entries) {
        HubProperties properties = new HubProperties();
        properties.setActors(List.of(entries));
        return properties;
    }

    private static HubProperties.ActorEntry entry(String id, String token, String... roles) {
        HubProperties.ActorEntry entry = new HubProperties.ActorEntry();
        entry.setId(id);
        entry.setToken(token);
        entry.setRoles(List.of(roles));
        return entry;
    }
}
