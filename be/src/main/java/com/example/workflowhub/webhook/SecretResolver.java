package com.example.workflowhub.webhook;

import java.util.Optional;

/**
 * Resolves the shared signing secret of a webhook source. Empty when the source is not configured.
 */
public interface SecretResolver {

    Optional<String> resolve(String source);
}
