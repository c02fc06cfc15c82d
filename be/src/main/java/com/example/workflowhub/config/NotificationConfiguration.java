package com.example.workflowhub.config;

import com.example.workflowhub.notification.NotificationRetryPolicy;
import com.example.workflowhub.sync.ExternalSyncClient;
import com.example.workflowhub.sync.HttpExternalSyncClient;
import com.example.workflowhub.sync.LoggingExternalSyncClient;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Beans behind post-transition actions: the delivery pool, the retry policy and the system-of-record client.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(HubProperties.class)
public class NotificationConfiguration {

    /**
     * Pool running notification deliveries and their delayed retries, independent of request threads.
     */
    @Bean(name = "notificationScheduler", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "notificationScheduler")
    public ScheduledExecutorService notificationScheduler(HubProperties properties) {
        int poolSize = Math.max(properties.getNotifications().getPoolSize(), 1);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("notify-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(poolSize, threadFactory);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Bean
    public NotificationRetryPolicy notificationRetryPolicy(HubProperties properties) {
        NotificationRetryPolicy policy = NotificationRetryPolicy.from(properties.getNotifications().getRetry());
        log.info("Notification retry policy: {}", policy);
        return policy;
    }

    @Bean
    @ConditionalOnMissingBean(ExternalSyncClient.class)
    public ExternalSyncClient externalSyncClient(HubProperties properties) {
        HubProperties.Sync sync = properties.getSync();
        if (sync.getBaseUrl() == null || sync.getBaseUrl().isBlank()) {
            log.info("No system-of-record url configured; external sync is log only (policy={})", sync.getPolicy());
            return new LoggingExternalSyncClient();
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(sync.getTimeout());
        requestFactory.setReadTimeout(sync.getTimeout());
        log.info("External sync to {} (policy={})", sync.getBaseUrl(), sync.getPolicy());
        return new HttpExternalSyncClient(RestClient.builder()
                .baseUrl(sync.getBaseUrl())
                .requestFactory(requestFactory)
                .build());
    }
}
