package com.example.workflowhub.webhook;

import com.example.workflowhub.config.HubProperties;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Token bucket per {@code (source, caller)}, refilled continuously at the source's permits-per-second up to its
 * burst size. Idle buckets are evicted from a Guava cache after {@link #IDLE_EXPIRY_MINUTES}.
 */
@Component
@Slf4j
public class TokenBucketRateLimiter implements WebhookRateLimiter {

    static final long IDLE_EXPIRY_MINUTES = 10;

    private final HubProperties properties;
    private final Ticker ticker;
    private final Cache<BucketKey, TokenBucket> buckets;

    public TokenBucketRateLimiter(HubProperties properties, Ticker webhookTicker) {
        this.properties = properties;
        this.ticker = webhookTicker;
        this.buckets = CacheBuilder.newBuilder()
                .expireAfterAccess(IDLE_EXPIRY_MINUTES, TimeUnit.MINUTES)
                .ticker(webhookTicker)
                .build();
    }

    @Override
    public boolean tryAcquire(String source, String caller) {
        HubProperties.RateLimit limit = limitFor(source);
        TokenBucket bucket = buckets.asMap().computeIfAbsent(new BucketKey(source, caller),
                key -> new TokenBucket(limit.getPermitsPerSecond(), Math.max(limit.getBurst(), 1), ticker.read()));
        boolean acquired = bucket.tryTake(ticker.read());
        if (!acquired) {
            log.debug("Rate limit exhausted source={} caller={}", source, caller);
        }
        return acquired;
    }

    private HubProperties.RateLimit limitFor(String source) {
        HubProperties.Source configured = properties.getWebhooks().getSources().get(source);
        return configured != null ? configured.getRateLimit() : new HubProperties.RateLimit();
    }

    private record BucketKey(String source, String caller) {
    }

    private static final class TokenBucket {

        private final double permitsPerNano;
        private final double capacity;
        private double tokens;
        private long lastRefillNanos;

        TokenBucket(double permitsPerSecond, int burst, long nowNanos) {
            this.permitsPerNano = permitsPerSecond / TimeUnit.SECONDS.toNanos(1);
            this.capacity = burst;
            this.tokens = burst;
            this.lastRefillNanos = nowNanos;
        }

        synchronized boolean tryTake(long nowNanos) {
            long elapsed = Math.max(0L, nowNanos - lastRefillNanos);
            tokens = Math.min(capacity, tokens + elapsed * permitsPerNano);
            lastRefillNanos = nowNanos;
            if (tokens < 1.0) {
                return false;
            }
            tokens -= 1.0;
            return true;
        }
    }
}
