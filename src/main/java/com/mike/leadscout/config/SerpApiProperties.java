package com.mike.leadscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "serpapi")
public record SerpApiProperties(
        String apiKey,
        String baseUrl,
        String defaultCountry,
        String defaultLanguage,
        String defaultEngine
) {
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
