package com.mike.leadscout.email;

/**
 * How a candidate was established. Decides how much a catch-all domain weakens it.
 */
public enum Evidence {
    /**
     * Already adjusted when it was cached.
     */
    CACHED,
    /**
     * Third-party intelligence or verification API.
     */
    API,
    /**
     * Published by the business itself: website, social profile, search snippet, registry.
     */
    DISCOVERED,
    /**
     * Constructed local part confirmed only by the mail server or an MX record.
     */
    PATTERN;

    public boolean isPatternBased() {
        return this == PATTERN;
    }
}
