package com.example.workflowhub.notification;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Delivers notifications as a JSON POST to the collaborator's endpoint. Non-2xx responses and I/O errors
 * surface as {@link org.springframework.web.client.RestClientException}.
 */
@Slf4j
public class HttpCollaborator implements Collaborator {

    private final String name;
    private final RestClient restClient;

    public HttpCollaborator(String name, RestClient restClient) {
        this.name = name;
        this.restClient = restClient;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void notify(NotificationMessage message) {
        log.debug("POST notification collaborator={} entityId={} state={}", name, message.entityId(), message.newState());
        restClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .body(message)
                .retrieve()
                .toBodilessEntity();
    }
}
