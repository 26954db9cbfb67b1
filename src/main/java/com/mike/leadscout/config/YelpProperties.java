package com.mike.leadscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "yelp")
public record YelpProperties(
        String apiKey,
        String baseUrl,
        int pageSize
) {
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
