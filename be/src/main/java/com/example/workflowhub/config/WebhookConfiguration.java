package com.example.workflowhub.config;

import com.google.common.base.Ticker;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Webhook gateway beans.
 */
@Configuration
public class WebhookConfiguration {

    /**
     * Clock for rate-limit refill and bucket expiry.
     */
    @Bean
    public Ticker webhookTicker() {
        return Ticker.systemTicker();
    }
}
