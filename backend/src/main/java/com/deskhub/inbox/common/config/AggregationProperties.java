package com.deskhub.inbox.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.aggregation")
public record AggregationProperties(
        int poolSize,
        int queueCapacity,
        long timeoutMs
) {

    public AggregationProperties {
        poolSize = poolSize <= 0 ? 8 : Math.min(poolSize, 64);
        queueCapacity = queueCapacity <= 0 ? 1000 : queueCapacity;
        timeoutMs = timeoutMs <= 0 ? 15_000 : timeoutMs;
    }
}
