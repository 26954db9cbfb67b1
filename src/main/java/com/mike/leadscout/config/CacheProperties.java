package com.mike.leadscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "leadscout.cache")
public record CacheProperties(
        Backend backend,
        long maxEntries
) {
    public enum Backend {
        MEMORY, JPA
    }
}
