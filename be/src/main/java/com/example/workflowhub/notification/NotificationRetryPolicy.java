package com.example.workflowhub.notification;

import com.example.workflowhub.config.HubProperties;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff for notification delivery.
 * <p>
 * A delivery is attempted once and retried at most {@code maxRetries} times; the delay before retry
 * {@code n} (1-based) is {@code initialDelay * multiplier^(n-1)}, capped at {@code maxDelay}.
 * Immutable and thread-safe.
 * </p>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class NotificationRetryPolicy {

    public static final NotificationRetryPolicy DEFAULT = NotificationRetryPolicy.builder().build();

    @Builder.Default
    private final int maxRetries = 3;

    @Builder.Default
    private final Duration initialDelay = Duration.ofMillis(500);

    @Builder.Default
    private final double multiplier = 2.0;

    @Builder.Default
    private final Duration maxDelay = Duration.ofSeconds(30);

    public static NotificationRetryPolicy from(HubProperties.Retry retry) {
        return NotificationRetryPolicy.builder()
                .maxRetries(Math.max(retry.getMaxRetries(), 0))
                .initialDelay(retry.getInitialDelay())
                .multiplier(Math.max(retry.getMultiplier(), 1.0))
                .maxDelay(retry.getMaxDelay())
                .build();
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public Duration delayBeforeRetry(int retryNumber) {
        double factor = Math.pow(multiplier, Math.max(retryNumber - 1, 0));
        long millis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(millis, 0L));
    }
}
