package com.mike.leadscout.cache;

import java.time.Instant;

public record CacheEntry(
        String domain,
        String email,
        double confidence,
        String source,
        boolean catchAll,
        Instant cachedAt
) {
}
