package com.example.workflowhub.sync;

import com.example.workflowhub.service.EntitySnapshot;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Pushes entity state to the system of record with {@code PUT {baseUrl}/records/{workflowType}/{entityId}}.
 */
@Slf4j
public class HttpExternalSyncClient implements ExternalSyncClient {

    private final RestClient restClient;

    public HttpExternalSyncClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public void push(EntitySnapshot entity) {
        log.debug("Pushing entityId={} state={} version={} to system of record", entity.id(), entity.state(), entity.version());
        try {
            restClient.put()
                    .uri("/records/{workflowType}/{entityId}", entity.workflowType(), entity.id())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(entity)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new ExternalSyncException("System of record sync failed for entity " + entity.id(), e);
        }
    }
}
