package com.mike.leadscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "leadscout.browser")
public record BrowserProperties(
        Backend backend,
        Duration navigationTimeout,
        String userAgent,
        boolean headless
) {
    public enum Backend {
        PLAYWRIGHT, JSOUP
    }

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    public String effectiveUserAgent() {
        return userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }
}
