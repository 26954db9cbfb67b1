package com.mike.leadscout.resilience;

import lombok.Getter;

/**
 * Base of every failure the lead pipeline raises on its own. {@code source} names the external
 * source or provider key involved, or is null for internal failures.
 */
@Getter
public class LeadScoutException extends RuntimeException {

    private final String source;

    public LeadScoutException(String message) {
        this(null, message, null);
    }

    public LeadScoutException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
