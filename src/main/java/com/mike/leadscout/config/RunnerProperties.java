package com.mike.leadscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "leadscout.runner")
public record RunnerProperties(
        boolean enabled,
        String query,
        String location,
        int count
) {
}
