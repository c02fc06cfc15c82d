package com.example.workflowhub.config;

import com.example.workflowhub.sync.SyncPolicy;

import lombok.Data;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hub configuration bound from the {@code hub} prefix.
 * <p>
 * Secrets (actor tokens, webhook signing secrets) are expected to come from environment placeholders,
 * never from committed configuration.
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "hub")
public class HubProperties {

    /** Actor directory used by the upstream authentication filter. */
    private List<ActorEntry> actors = new ArrayList<>();

    /** Named collaborators; an entry without url is a log-only sink. */
    private Map<String, CollaboratorEntry> collaborators = new LinkedHashMap<>();

    private Notifications notifications = new Notifications();

    private Sync sync = new Sync();

    private Webhooks webhooks = new Webhooks();

    @Data
    public static class ActorEntry {
        private String id;
        private String token;
        private List<String> roles = new ArrayList<>();
    }

    @Data
    public static class CollaboratorEntry {
        private String url;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Notifications {
        /** Threads delivering notifications and running retries. */
        private int poolSize = 4;
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class Sync {
        private SyncPolicy policy = SyncPolicy.BEST_EFFORT;
        /** Base url of the external system of record; blank means sync is only logged. */
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Webhooks {
        private Map<String, Source> sources = new LinkedHashMap<>();
    }

    @Data
    public static class Source {
        private String secret;
        /** Roles of the system actor used for transitions driven by this source. */
        private List<String> actorRoles = new ArrayList<>();
        private RateLimit rateLimit = new RateLimit();
    }

    @Data
    public static class RateLimit {
        private double permitsPerSecond = 5.0;
        private int burst = 20;
    }
}
