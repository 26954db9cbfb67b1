package com.mike.leadscout.cache;

import java.time.Duration;

/**
 * Age tiers of a cached email. Boundaries are exclusive on the upper side:
 * an entry exactly 24h old is RECENT, exactly 7d is AGING, exactly 30d is STALE.
 */
public enum Freshness {
    FRESH(1.0),
    RECENT(0.9),
    AGING(0.7),
    STALE(0.5);

    static final Duration FRESH_LIMIT = Duration.ofHours(24);
    static final Duration RECENT_LIMIT = Duration.ofDays(7);
    static final Duration AGING_LIMIT = Duration.ofDays(30);

    private final double score;

    Freshness(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }

    public boolean isUsable() {
        return this != STALE;
    }

    public boolean shouldReverify() {
        return this == AGING || this == STALE;
    }

    public static Freshness of(Duration age) {
        if (age.compareTo(FRESH_LIMIT) < 0) return FRESH;
        if (age.compareTo(RECENT_LIMIT) < 0) return RECENT;
        if (age.compareTo(AGING_LIMIT) < 0) return AGING;
        return STALE;
    }
}
