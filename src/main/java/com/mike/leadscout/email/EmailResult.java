package com.mike.leadscout.email;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of the cascade for one business. Confidence is already catch-all adjusted.
 */
@Value
@Builder(toBuilder = true)
public class EmailResult {
    String email;
    String source;
    double confidence;
    DiscoveryPhase phase;
    boolean catchAll;
    String discoveredWebsite;

    public static EmailResult none(String discoveredWebsite) {
        return EmailResult.builder()
                .source("none")
                .confidence(0.0)
                .discoveredWebsite(discoveredWebsite)
                .build();
    }

    public boolean isFound() {
        return email != null;
    }
}
