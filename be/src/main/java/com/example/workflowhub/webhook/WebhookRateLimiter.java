package com.example.workflowhub.webhook;

/**
 * Admission control for webhook calls, keyed by source and caller.
 */
public interface WebhookRateLimiter {

    /**
     * Takes one permit for {@code (source, caller)}; false when the caller has exhausted its allowance.
     */
    boolean tryAcquire(String source, String caller);
}
