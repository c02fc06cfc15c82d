package com.example.workflowhub.security;

import com.example.workflowhub.config.HubProperties;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bearer tokens to actors, from {@code hub.actors}. Entries without token are ignored.
 */
@Component
@Slf4j
public class ActorDirectory {

    private final Map<String, Actor> actorsByToken;

    public ActorDirectory(HubProperties properties) {
        Map<String, Actor> byToken = new HashMap<>();
        for (HubProperties.ActorEntry entry : properties.getActors()) {
            if (entry.getId() == null || entry.getToken() == null || entry.getToken().isBlank()) {
                log.warn("Skipping actor entry without id or token id={}", entry.getId());
                continue;
            }
            if (byToken.putIfAbsent(entry.getToken(), new Actor(entry.getId(), Set.copyOf(entry.getRoles()))) != null) {
                throw new IllegalStateException("Duplicate actor token configured for actor " + entry.getId());
            }
        }
        this.actorsByToken = Map.copyOf(byToken);
        log.info("Actor directory loaded with {} actor(s)", actorsByToken.size());
    }

    public Optional<Actor> authenticate(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(actorsByToken.get(token));
    }
}
