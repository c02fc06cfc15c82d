package com.example.workflowhub.notification;

import com.example.workflowhub.config.HubProperties;
import com.example.workflowhub.sync.ExternalSyncClient;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of collaborators by name, used by the dispatcher and by definition validation.
 * <p>
 * Built from {@code hub.collaborators} (an entry with url becomes an {@link HttpCollaborator}, without url a
 * {@link LoggingCollaborator}), the built-in {@value SystemOfRecordCollaborator#NAME}, and any
 * {@link Collaborator} beans, which replace configured entries of the same name.
 * </p>
 */
@Component
@Slf4j
public class CollaboratorRegistry {

    private final Map<String, Collaborator> collaborators;

    public CollaboratorRegistry(HubProperties properties, ExternalSyncClient syncClient, ObjectProvider<Collaborator> beans) {
        Map<String, Collaborator> byName = new LinkedHashMap<>();
        properties.getCollaborators().forEach((name, entry) -> byName.put(name, fromConfig(name, entry)));
        byName.put(SystemOfRecordCollaborator.NAME, new SystemOfRecordCollaborator(syncClient));
        beans.orderedStream().forEach(bean -> byName.put(bean.name(), bean));
        this.collaborators = Map.copyOf(byName);
        log.info("Registered collaborators: {}", collaborators.keySet());
    }

    private static Collaborator fromConfig(String name, HubProperties.CollaboratorEntry entry) {
        if (entry == null || entry.getUrl() == null || entry.getUrl().isBlank()) {
            return new LoggingCollaborator(name);
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(entry.getTimeout());
        requestFactory.setReadTimeout(entry.getTimeout());
        RestClient restClient = RestClient.builder()
                .baseUrl(entry.getUrl())
                .requestFactory(requestFactory)
                .build();
        return new HttpCollaborator(name, restClient);
    }

    public Optional<Collaborator> find(String name) {
        return Optional.ofNullable(collaborators.get(name));
    }

    public Set<String> names() {
        return collaborators.keySet();
    }
}
