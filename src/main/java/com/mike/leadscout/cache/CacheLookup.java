package com.mike.leadscout.cache;

public record CacheLookup(
        CacheEntry entry,
        Freshness freshness
) {
    public double freshnessScore() {
        return freshness.score();
    }

    public boolean shouldReverify() {
        return freshness.shouldReverify();
    }
}
