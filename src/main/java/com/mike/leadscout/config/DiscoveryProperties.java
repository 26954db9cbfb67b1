package com.mike.leadscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "leadscout.discovery")
public record DiscoveryProperties(
        double overfetchFactor,
        int workers,
        Duration jobTimeout,
        double similarityThreshold,
        double minQualityScore,
        int maxResults
) {
    public static DiscoveryProperties defaults() {
        return new DiscoveryProperties(1.5, 4, Duration.ofMinutes(10), 0.75, 0.2, 500);
    }
}
