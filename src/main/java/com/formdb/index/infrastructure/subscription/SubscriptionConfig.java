package com.formdb.index.infrastructure.subscription;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for change-event fan-out
 */
@Component
@ConfigurationProperties(prefix = "formdb.subscription")
public class SubscriptionConfig {

    private int queueCapacity = 1024;
    private int idleSeconds = 60;

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getIdleSeconds() {
        return idleSeconds;
    }

    public void setIdleSeconds(int idleSeconds) {
        this.idleSeconds = idleSeconds;
    }
}
