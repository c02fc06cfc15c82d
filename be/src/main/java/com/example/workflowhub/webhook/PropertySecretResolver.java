package com.example.workflowhub.webhook;

import com.example.workflowhub.config.HubProperties;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads secrets from {@code hub.webhooks.sources.<source>.secret}. A blank secret counts as unconfigured.
 */
@Component
@RequiredArgsConstructor
public class PropertySecretResolver implements SecretResolver {

    private final HubProperties properties;

    @Override
    public Optional<String> resolve(String source) {
        if (source == null) {
            return Optional.empty();
        }
        HubProperties.Source configured = properties.getWebhooks().getSources().get(source);
        if (configured == null || configured.getSecret() == null || configured.getSecret().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(configured.getSecret());
    }
}
