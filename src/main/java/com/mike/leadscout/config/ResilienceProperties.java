package com.mike.leadscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "leadscout.resilience")
public record ResilienceProperties(
        Retry retry,
        Breaker breaker,
        Duration callTimeout,
        int minSuccessfulSources
) {
    public record Retry(
            int maxRetries,
            Duration initialDelay,
            Duration maxDelay,
            double multiplier,
            double jitter
    ) {
    }

    public record Breaker(
            int failureThreshold,
            Duration resetTimeout,
            int halfOpenRequests
    ) {
    }

    public static ResilienceProperties defaults() {
        return new ResilienceProperties(
                new Retry(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.3),
                new Breaker(5, Duration.ofSeconds(60), 2),
                Duration.ofSeconds(30),
                1
        );
    }
}
