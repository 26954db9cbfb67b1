package com.mike.leadscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Set;

@ConfigurationProperties(prefix = "leadscout.email")
public record EmailProperties(
        boolean mxCheckEnabled,
        MxUnknownPolicy mxUnknownPolicy,
        long mxTimeoutMs,
        Smtp smtp,
        Set<String> knownTlds
) {
    public enum MxUnknownPolicy {
        WARN, DROP, ALLOW
    }

    public record Smtp(
            boolean enabled,
            Duration timeout,
            String heloHost,
            String mailFrom
    ) {
    }
}
